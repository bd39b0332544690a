package com.greenwashradar.pipeline.dto;

import java.util.List;

/**
 * Terminal output of a job, handed to the downstream writer exactly once per job key.
 */
public record AnalysisBundle(
        String jobKey,
        String companyCode,
        String companyName,
        String industry,
        int reportYear,
        String reportSourceUrl,
        List<Claim> claims,
        List<Evidence> evidence,
        String sideArtifactRef,
        RiskSummary riskSummary
) {
}
