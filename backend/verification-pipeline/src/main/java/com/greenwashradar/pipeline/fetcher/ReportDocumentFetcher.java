package com.greenwashradar.pipeline.fetcher;

import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportQuery;

/**
 * Fetches a company's sustainability report for one year.
 * Throws {@link com.greenwashradar.pipeline.exception.DocumentNotFoundException} when the source has none.
 */
public interface ReportDocumentFetcher extends SourceFetcher<ReportQuery, ReportDocument> {
}
