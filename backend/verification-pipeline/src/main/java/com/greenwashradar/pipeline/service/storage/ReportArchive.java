package com.greenwashradar.pipeline.service.storage;

import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportDocumentRef;

/**
 * Keeps fetched report documents so later stages and resumed jobs never download twice.
 */
public interface ReportArchive {

    /**
     * Stores the document under the job key, replacing any earlier copy.
     */
    ReportDocumentRef store(JobKey key, ReportDocument document);

    /**
     * @throws com.greenwashradar.pipeline.exception.DocumentNotFoundException when the archived copy is gone
     */
    ReportDocument load(ReportDocumentRef ref);

    void delete(ReportDocumentRef ref);
}
