package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.client.SideArtifactGenerator;
import com.greenwashradar.pipeline.dto.AnalysisBundle;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.RiskSummary;
import com.greenwashradar.pipeline.dto.SideArtifact;
import com.greenwashradar.pipeline.dto.ValidationContext;
import com.greenwashradar.pipeline.dto.ValidationReport;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.service.analysis.RiskSummaryCalculator;
import com.greenwashradar.pipeline.service.storage.AnalysisResultWriter;
import com.greenwashradar.pipeline.service.storage.ReportArchive;
import com.greenwashradar.pipeline.service.validation.EvidenceValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates evidence links, retries a pending side artifact once and hands the finished
 * analysis to the result writer. The writer is idempotent by job key, so a rerun after a
 * failed checkpoint write does not duplicate the output.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceValidationStage implements StageHandler {

    private final EvidenceValidator evidenceValidator;
    private final SideArtifactGenerator sideArtifactGenerator;
    private final ReportArchive reportArchive;
    private final AnalysisResultWriter resultWriter;
    private final RiskSummaryCalculator riskSummaryCalculator;

    @Override
    public AnalysisStage stage() {
        return AnalysisStage.SOURCE_VALIDATION;
    }

    @Override
    public JobArtifacts execute(AnalysisJob job) {
        JobArtifacts artifacts = job.getArtifacts();

        Map<String, String> claimText = new LinkedHashMap<>();
        for (Claim claim : artifacts.getClaims()) {
            if (claim.getText() != null) {
                claimText.put(claim.getId(), claim.getText());
            }
        }
        ValidationContext context = new ValidationContext(job.getJobKey(), job.getCompanyName(),
                job.getCompanyDomain(), job.getReportYear(), claimText);
        ValidationReport report = evidenceValidator.validate(artifacts.getEvidence(), context);

        Set<String> surviving = report.evidence().stream().map(Evidence::getId).collect(Collectors.toSet());
        List<Claim> claims = artifacts.getClaims().stream()
                .map(claim -> claim.toBuilder()
                        .evidenceIds(claim.getEvidenceIds().stream().filter(surviving::contains)
                                .collect(Collectors.toCollection(ArrayList::new)))
                        .build())
                .toList();

        String sideArtifactRef = artifacts.getSideArtifactRef();
        boolean sidePending = artifacts.isSideArtifactPending();
        if (sidePending) {
            SideArtifact retried = retrySideArtifact(job);
            if (retried != null) {
                sideArtifactRef = retried.reference();
                sidePending = false;
            }
        }

        RiskSummary summary = riskSummaryCalculator.summarize(claims);
        resultWriter.write(new AnalysisBundle(
                job.getJobKey(),
                job.getCompanyCode(),
                job.getCompanyName(),
                job.getIndustry(),
                job.getReportYear(),
                artifacts.getDocument() != null ? artifacts.getDocument().sourceUrl() : null,
                claims,
                report.evidence(),
                sideArtifactRef,
                summary));

        return artifacts.toBuilder()
                .claims(new ArrayList<>(claims))
                .evidence(new ArrayList<>(report.evidence()))
                .sideArtifactRef(sideArtifactRef)
                .sideArtifactPending(sidePending)
                .riskSummary(summary)
                .build();
    }

    private SideArtifact retrySideArtifact(AnalysisJob job) {
        if (job.getArtifacts().getDocument() == null) {
            return null;
        }
        try {
            SideArtifact artifact = sideArtifactGenerator.generate(job.getKey(),
                    reportArchive.load(job.getArtifacts().getDocument()));
            log.info("[{}] Side artifact generated on retry", job.getJobKey());
            return artifact;
        } catch (RuntimeException e) {
            log.warn("[{}] Side artifact retry failed, handing off without it: {}", job.getJobKey(), e.toString());
            return null;
        }
    }
}
