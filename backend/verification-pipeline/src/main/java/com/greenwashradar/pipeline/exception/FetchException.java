package com.greenwashradar.pipeline.exception;

/**
 * Failure of a source fetch.
 * Transient failures (timeout, connection reset, 5xx) are retried by the call policy and count
 * against the source's circuit; a rejected request (4xx other than 429, missing configuration)
 * surfaces immediately.
 */
public class FetchException extends PipelineException {

    private final boolean transientFailure;

    public FetchException(String message) {
        this(message, true);
    }

    public FetchException(String message, boolean transientFailure) {
        super(PipelineErrorCode.FETCH_ERROR, message);
        this.transientFailure = transientFailure;
    }

    public FetchException(String message, Throwable cause) {
        super(PipelineErrorCode.FETCH_ERROR, message, cause);
        this.transientFailure = true;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public static FetchException timeout(String source, Throwable cause) {
        return new FetchException("Timed out fetching from " + source, cause);
    }

    public static FetchException serverError(String source, int status) {
        return new FetchException(source + " answered HTTP " + status);
    }

    public static FetchException rejected(String source, int status) {
        return new FetchException(source + " rejected the request with HTTP " + status, false);
    }

    /**
     * Maps an error status other than 429: 5xx and 408 are transient, other 4xx are not.
     */
    public static FetchException forStatus(String source, int status) {
        return status >= 500 || status == 408 ? serverError(source, status) : rejected(source, status);
    }
}
