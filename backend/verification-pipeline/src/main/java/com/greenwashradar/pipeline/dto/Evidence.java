package com.greenwashradar.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * External reference backing or contradicting one claim.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Evidence {

    private String id;
    private String claimId;
    private String url;
    private String title;
    private String snippet;
    private String publishedAt;

    @Builder.Default
    private EvidenceLiveness liveness = EvidenceLiveness.UNCHECKED;

    private boolean repaired;

    /**
     * URL before repair. Only set when {@link #repaired} is true.
     */
    private String originalUrl;
}
