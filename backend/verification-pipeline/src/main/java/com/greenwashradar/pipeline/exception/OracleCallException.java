package com.greenwashradar.pipeline.exception;

/**
 * A single oracle round trip failed.
 * Retryable failures (timeouts, 5xx) are retried by the call policy; the rest surface immediately.
 */
public class OracleCallException extends PipelineException {

    private final boolean transientFailure;

    public OracleCallException(String message, boolean transientFailure) {
        super(PipelineErrorCode.ORACLE_UNAVAILABLE, message);
        this.transientFailure = transientFailure;
    }

    public OracleCallException(String message, boolean transientFailure, Throwable cause) {
        super(PipelineErrorCode.ORACLE_UNAVAILABLE, message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public static OracleCallException timeout(String oracle, Throwable cause) {
        return new OracleCallException(oracle + " call timed out", true, cause);
    }

    public static OracleCallException serverError(String oracle, int status) {
        return new OracleCallException(oracle + " answered HTTP " + status, true);
    }

    public static OracleCallException rejected(String oracle, int status) {
        return new OracleCallException(oracle + " rejected the request with HTTP " + status, false);
    }
}
