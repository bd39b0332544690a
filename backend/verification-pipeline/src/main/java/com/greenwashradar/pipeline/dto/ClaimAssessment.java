package com.greenwashradar.pipeline.dto;

/**
 * Cross-check verdict for one claim as returned by the oracle.
 *
 * @param evidenceUrl URL the oracle cited, may differ from the searched article
 */
public record ClaimAssessment(
        String claimId,
        ClaimConsistency consistency,
        int adjustedRiskScore,
        String rationale,
        String evidenceUrl,
        String evidenceSummary
) {
}
