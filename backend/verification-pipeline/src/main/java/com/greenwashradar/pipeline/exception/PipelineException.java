package com.greenwashradar.pipeline.exception;

/**
 * Base class of all pipeline failures.
 * Carries an error code and, when known, the job key ({@code {year}_{companyCode}}).
 */
public class PipelineException extends RuntimeException {

    private final PipelineErrorCode errorCode;
    private final String jobKey;

    public PipelineException(PipelineErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public PipelineException(PipelineErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public PipelineException(PipelineErrorCode errorCode, String message, String jobKey) {
        this(errorCode, message, jobKey, null);
    }

    public PipelineException(PipelineErrorCode errorCode, String message, String jobKey, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.jobKey = jobKey;
    }

    public PipelineErrorCode getErrorCode() {
        return errorCode;
    }

    public String getJobKey() {
        return jobKey;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
