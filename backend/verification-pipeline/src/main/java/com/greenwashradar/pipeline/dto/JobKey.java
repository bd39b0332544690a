package com.greenwashradar.pipeline.dto;

import java.util.Objects;

/**
 * Identity of a unit of work: one company in one reporting year.
 */
public record JobKey(String companyCode, int reportYear) {

    public JobKey {
        Objects.requireNonNull(companyCode, "companyCode");
        if (companyCode.isBlank()) {
            throw new IllegalArgumentException("companyCode must not be blank");
        }
    }

    /**
     * Stable string form, e.g. {@code 2024_1101}.
     */
    public String asString() {
        return reportYear + "_" + companyCode;
    }

    @Override
    public String toString() {
        return asString();
    }
}
