package com.greenwashradar.pipeline.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral request to the scoring oracle.
 * For claim extraction {@code document} is set, for cross-check {@code claims} and {@code evidenceByClaim}.
 */
@Value
@Builder
public class OracleRequest {
    OracleTask task;
    String jobKey;
    String companyName;
    String industry;
    int reportYear;
    String framework;
    ReportDocument document;
    @Builder.Default
    List<Claim> claims = List.of();
    @Builder.Default
    Map<String, List<Evidence>> evidenceByClaim = Map.of();
}
