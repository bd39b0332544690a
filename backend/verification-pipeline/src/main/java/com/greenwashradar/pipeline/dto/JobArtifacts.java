package com.greenwashradar.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a job has produced so far. Stored as JSON next to the checkpoint,
 * so every field must stay Jackson-serializable.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobArtifacts {

    private ReportDocumentRef document;

    @Builder.Default
    private List<Claim> claims = new ArrayList<>();

    /**
     * News search outcome per claim id, in claim order.
     */
    @Builder.Default
    private Map<String, TopicFetchOutcome> newsOutcomes = new LinkedHashMap<>();

    @Builder.Default
    private List<Evidence> evidence = new ArrayList<>();

    private String sideArtifactRef;

    private boolean sideArtifactPending;

    private RiskSummary riskSummary;
}
