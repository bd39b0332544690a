package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.client.SideArtifactGenerator;
import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.SideArtifact;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.DocumentNotFoundException;
import com.greenwashradar.pipeline.exception.PipelineErrorCode;
import com.greenwashradar.pipeline.exception.PipelineException;
import com.greenwashradar.pipeline.service.analysis.AnalysisInvoker;
import com.greenwashradar.pipeline.service.storage.ReportArchive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Extracts claims and, alongside, generates the side artifact.
 * <p>
 * Both branches start together and the stage waits for both. A failed claim extraction
 * fails the stage. A failed side artifact only sets the pending flag; source validation
 * tries it once more.
 */
@Component
@Slf4j
public class ClaimExtractionStage implements StageHandler {

    private final AnalysisInvoker analysisInvoker;
    private final SideArtifactGenerator sideArtifactGenerator;
    private final ReportArchive reportArchive;
    private final Executor stageExecutor;
    private final PipelineProperties properties;

    public ClaimExtractionStage(AnalysisInvoker analysisInvoker,
                                SideArtifactGenerator sideArtifactGenerator,
                                ReportArchive reportArchive,
                                @Qualifier("stageExecutor") Executor stageExecutor,
                                PipelineProperties properties) {
        this.analysisInvoker = analysisInvoker;
        this.sideArtifactGenerator = sideArtifactGenerator;
        this.reportArchive = reportArchive;
        this.stageExecutor = stageExecutor;
        this.properties = properties;
    }

    @Override
    public AnalysisStage stage() {
        return AnalysisStage.CLAIM_EXTRACTION;
    }

    @Override
    public JobArtifacts execute(AnalysisJob job) {
        JobArtifacts artifacts = job.getArtifacts();
        if (artifacts.getDocument() == null) {
            throw DocumentNotFoundException.inArchive(job.getJobKey());
        }
        ReportDocument document = reportArchive.load(artifacts.getDocument());

        CompletableFuture<List<Claim>> claimsBranch = CompletableFuture
                .supplyAsync(() -> analysisInvoker.extractClaims(job, document), stageExecutor);
        CompletableFuture<SideArtifact> sideBranch = CompletableFuture
                .supplyAsync(() -> sideArtifactGenerator.generate(job.getKey(), document), stageExecutor)
                .orTimeout(properties.getAnalysis().getSideArtifactTimeout().toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture.allOf(
                claimsBranch.handle((result, error) -> null),
                sideBranch.handle((result, error) -> null)
        ).join();

        List<Claim> claims = joinClaims(job, claimsBranch);

        String sideArtifactRef = null;
        boolean sidePending = false;
        try {
            SideArtifact side = sideBranch.join();
            sideArtifactRef = side.reference();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[{}] Side artifact generation failed, will retry before hand-off: {}",
                    job.getJobKey(), cause.toString());
            sidePending = true;
        }

        return artifacts.toBuilder()
                .claims(new ArrayList<>(claims))
                .sideArtifactRef(sideArtifactRef)
                .sideArtifactPending(sidePending)
                .build();
    }

    private static List<Claim> joinClaims(AnalysisJob job, CompletableFuture<List<Claim>> claimsBranch) {
        try {
            return claimsBranch.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new PipelineException(PipelineErrorCode.STAGE_FAILED,
                    "Claim extraction failed: " + cause.getMessage(), job.getJobKey(), cause);
        }
    }
}
