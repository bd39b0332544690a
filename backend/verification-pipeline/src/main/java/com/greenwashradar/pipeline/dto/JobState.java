package com.greenwashradar.pipeline.dto;

/**
 * Externally reported state of an analysis job.
 */
public enum JobState {
    /** A run is active, or queued, for the job. */
    IN_PROGRESS,
    COMPLETED,
    /** The last run stopped on a retryable error such as an unavailable oracle. */
    TEMPORARILY_UNAVAILABLE,
    /** The last run stopped on an error that retrying will not fix. */
    FAILED,
    /** Non-terminal checkpoint with no run in flight; submitting again resumes it. */
    INTERRUPTED,
    NOT_FOUND
}
