package com.greenwashradar.pipeline.entity;

/**
 * Ordered stages of one analysis job. Declaration order is execution order.
 */
public enum AnalysisStage {
    FETCHING,
    CLAIM_EXTRACTION,
    NEWS_CROSS_CHECK,
    EXTERNAL_VERIFICATION,
    SOURCE_VALIDATION,
    PERSISTED;

    public boolean isTerminal() {
        return this == PERSISTED;
    }

    public AnalysisStage next() {
        if (isTerminal()) {
            throw new IllegalStateException("No stage after " + this);
        }
        return values()[ordinal() + 1];
    }

    public boolean isAfter(AnalysisStage other) {
        return ordinal() > other.ordinal();
    }
}
