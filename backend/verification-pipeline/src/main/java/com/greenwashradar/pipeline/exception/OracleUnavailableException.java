package com.greenwashradar.pipeline.exception;

/**
 * Oracle unreachable after retries, or the circuit breaker is open.
 * Fatal to the current stage attempt; the job can be retried later.
 */
public class OracleUnavailableException extends PipelineException {

    public OracleUnavailableException(String message) {
        super(PipelineErrorCode.ORACLE_UNAVAILABLE, message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(PipelineErrorCode.ORACLE_UNAVAILABLE, message, cause);
    }

    public static OracleUnavailableException circuitOpen(String dependency) {
        return new OracleUnavailableException("Circuit breaker open for " + dependency);
    }

    public static OracleUnavailableException retriesExhausted(String dependency, Throwable cause) {
        return new OracleUnavailableException("Retries exhausted for " + dependency + ": " + cause.getMessage(), cause);
    }
}
