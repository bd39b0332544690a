package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimAssessment;
import com.greenwashradar.pipeline.dto.ClaimConsistency;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.EvidenceLiveness;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.service.analysis.AnalysisInvoker;
import com.greenwashradar.pipeline.service.analysis.RiskSummaryCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Asks the scoring oracle to judge each claim against its news evidence.
 * Claims without evidence are not sent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalVerificationStage implements StageHandler {

    private final AnalysisInvoker analysisInvoker;
    private final RiskSummaryCalculator riskSummaryCalculator;

    @Override
    public AnalysisStage stage() {
        return AnalysisStage.EXTERNAL_VERIFICATION;
    }

    @Override
    public JobArtifacts execute(AnalysisJob job) {
        JobArtifacts artifacts = job.getArtifacts();
        List<Claim> withEvidence = artifacts.getClaims().stream()
                .filter(Claim::hasEvidence)
                .toList();

        if (withEvidence.isEmpty()) {
            log.info("[{}] No claim has evidence, skipping external verification", job.getJobKey());
            return artifacts.toBuilder()
                    .riskSummary(riskSummaryCalculator.summarize(artifacts.getClaims()))
                    .build();
        }

        Map<String, List<Evidence>> evidenceByClaim = artifacts.getEvidence().stream()
                .collect(Collectors.groupingBy(Evidence::getClaimId, LinkedHashMap::new, Collectors.toList()));
        Map<String, ClaimAssessment> assessments = analysisInvoker.crossCheck(job, withEvidence, evidenceByClaim).stream()
                .collect(Collectors.toMap(ClaimAssessment::claimId, Function.identity()));

        List<Claim> claims = new ArrayList<>();
        List<Evidence> evidence = new ArrayList<>(artifacts.getEvidence());
        for (Claim claim : artifacts.getClaims()) {
            ClaimAssessment assessment = assessments.get(claim.getId());
            if (assessment == null) {
                claims.add(claim.hasEvidence()
                        ? claim.toBuilder().consistency(ClaimConsistency.UNVERIFIED).build()
                        : claim);
                continue;
            }
            claims.add(claim.toBuilder()
                    .consistency(assessment.consistency())
                    .riskScore(assessment.adjustedRiskScore())
                    .riskAdjustment(assessment.adjustedRiskScore() - claim.getRiskScore())
                    .rationale(assessment.rationale())
                    .build());
            applyCitedUrl(claim, assessment, evidence);
        }

        long contradicted = claims.stream().filter(c -> c.getConsistency() == ClaimConsistency.CONTRADICTED).count();
        log.info("[{}] External verification: assessed={}, contradicted={}",
                job.getJobKey(), assessments.size(), contradicted);
        return artifacts.toBuilder()
                .claims(claims)
                .evidence(evidence)
                .riskSummary(riskSummaryCalculator.summarize(claims))
                .build();
    }

    /**
     * The oracle may cite a different page than the searched article; that citation becomes
     * the claim's primary evidence and has to be validated again.
     */
    private static void applyCitedUrl(Claim claim, ClaimAssessment assessment, List<Evidence> evidence) {
        String cited = assessment.evidenceUrl();
        if (cited == null || cited.isBlank()) {
            return;
        }
        String primaryId = claim.getEvidenceIds().get(0);
        for (int i = 0; i < evidence.size(); i++) {
            Evidence item = evidence.get(i);
            if (item.getId().equals(primaryId) && !cited.trim().equals(item.getUrl())) {
                Evidence.EvidenceBuilder updated = item.toBuilder()
                        .url(cited.trim())
                        .liveness(EvidenceLiveness.UNCHECKED);
                if (assessment.evidenceSummary() != null && !assessment.evidenceSummary().isBlank()) {
                    updated.snippet(assessment.evidenceSummary());
                }
                evidence.set(i, updated.build());
            }
        }
    }
}
