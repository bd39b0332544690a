package com.greenwashradar.pipeline.dto;

import java.util.Map;

/**
 * Aggregate view over the claims of one job. The final ESG score is computed downstream.
 */
public record RiskSummary(
        int claimCount,
        double meanRiskScore,
        int contradictedCount,
        int claimsWithEvidence,
        Map<EsgCategory, CategoryRisk> byCategory
) {

    public record CategoryRisk(int claimCount, double meanRiskScore, int contradictedCount) {
    }
}
