package com.greenwashradar.pipeline.dto;

import java.util.List;

/**
 * Outcome of one validation pass.
 */
public record ValidationReport(
        List<Evidence> evidence,
        int alreadyLive,
        int verified,
        int repaired,
        int dropped
) {
}
