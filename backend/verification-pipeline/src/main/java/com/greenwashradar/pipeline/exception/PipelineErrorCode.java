package com.greenwashradar.pipeline.exception;

/**
 * Error taxonomy shared by every pipeline component.
 */
public enum PipelineErrorCode {

    /** Transient failure while fetching one topic or document; contained per topic. */
    FETCH_ERROR(true),

    /** All fallback tiers returned nothing. Not an error of the job. */
    NO_EVIDENCE(false),

    /** Remote side answered 429 or the shared rate limiter had no permit. */
    RATE_LIMITED(true),

    /** Retries exhausted or circuit breaker open. */
    ORACLE_UNAVAILABLE(true),

    /** Oracle output did not match the expected schema. */
    MALFORMED_OUTPUT(false),

    /** Another advance for the same job key is running or already moved the checkpoint. */
    CHECKPOINT_CONFLICT(true),

    /** A dead evidence link could not be repaired; the item is dropped. */
    VALIDATION_REPAIR_FAILED(false),

    /** The sustainability report does not exist at the source. */
    REPORT_NOT_FOUND(false),

    /** Unexpected failure inside a stage. */
    STAGE_FAILED(true);

    private final boolean retryable;

    PipelineErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
