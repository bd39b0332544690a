package com.greenwashradar.pipeline.service.analysis;

import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimConsistency;
import com.greenwashradar.pipeline.dto.EsgCategory;
import com.greenwashradar.pipeline.dto.RiskSummary;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates claim risk per ESG category.
 */
@Component
public class RiskSummaryCalculator {

    public RiskSummary summarize(List<Claim> claims) {
        Map<EsgCategory, RiskSummary.CategoryRisk> byCategory = new EnumMap<>(EsgCategory.class);
        for (EsgCategory category : EsgCategory.values()) {
            List<Claim> inCategory = claims.stream()
                    .filter(claim -> claim.getCategory() == category)
                    .toList();
            if (!inCategory.isEmpty()) {
                byCategory.put(category, new RiskSummary.CategoryRisk(
                        inCategory.size(), meanRisk(inCategory), contradicted(inCategory)));
            }
        }
        int withEvidence = (int) claims.stream().filter(Claim::hasEvidence).count();
        return new RiskSummary(claims.size(), meanRisk(claims), contradicted(claims), withEvidence, byCategory);
    }

    private static double meanRisk(List<Claim> claims) {
        double mean = claims.stream().mapToInt(Claim::getRiskScore).average().orElse(0.0);
        return Math.round(mean * 100.0) / 100.0;
    }

    private static int contradicted(List<Claim> claims) {
        return (int) claims.stream()
                .filter(claim -> claim.getConsistency() == ClaimConsistency.CONTRADICTED)
                .count();
    }
}
