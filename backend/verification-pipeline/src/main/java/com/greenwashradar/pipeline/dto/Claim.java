package com.greenwashradar.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A sustainability assertion extracted from the report.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Claim {

    private String id;
    private EsgCategory category;
    private String topic;          // SASB-style topic label
    private String pageNumber;
    private String text;
    private String keyword;        // short search keyword suggested by the oracle
    private String greenwashingFactor;
    private int riskScore;         // 0..4

    @Builder.Default
    private ClaimConsistency consistency = ClaimConsistency.PENDING;

    /**
     * Risk adjustment applied by the cross-check, already included in {@link #riskScore}.
     */
    private int riskAdjustment;

    private String rationale;

    @Builder.Default
    private List<String> evidenceIds = new ArrayList<>();

    public boolean hasEvidence() {
        return evidenceIds != null && !evidenceIds.isEmpty();
    }
}
