package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportDocumentRef;
import com.greenwashradar.pipeline.dto.ReportQuery;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.DocumentNotFoundException;
import com.greenwashradar.pipeline.fetcher.ReportDocumentFetcher;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import com.greenwashradar.pipeline.service.storage.ReportArchive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Downloads the report and keeps it in the archive.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentFetchStage implements StageHandler {

    private final ReportDocumentFetcher reportFetcher;
    private final ReportArchive reportArchive;
    private final ExternalCallPolicy callPolicy;

    @Override
    public AnalysisStage stage() {
        return AnalysisStage.FETCHING;
    }

    @Override
    public JobArtifacts execute(AnalysisJob job) {
        ReportQuery query = ReportQuery.of(job.getKey(), job.getCompanyName());
        ReportDocument document = callPolicy.execute(reportFetcher.getSourceId(), () -> reportFetcher.fetch(query));
        if (document == null || document.isEmpty()) {
            throw DocumentNotFoundException.atSource(job.getCompanyCode(), job.getReportYear());
        }
        ReportDocumentRef ref = reportArchive.store(job.getKey(), document);
        log.info("[{}] Report fetched: {} bytes from {}", job.getJobKey(), ref.sizeBytes(), ref.sourceUrl());
        return job.getArtifacts().toBuilder()
                .document(ref)
                .build();
    }
}
