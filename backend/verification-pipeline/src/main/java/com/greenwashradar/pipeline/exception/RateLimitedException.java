package com.greenwashradar.pipeline.exception;

/**
 * Remote dependency rejected the call with 429, or no local rate-limit permit was available.
 */
public class RateLimitedException extends PipelineException {

    public RateLimitedException(String message) {
        super(PipelineErrorCode.RATE_LIMITED, message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(PipelineErrorCode.RATE_LIMITED, message, cause);
    }

    public static RateLimitedException remote(String dependency) {
        return new RateLimitedException(dependency + " answered HTTP 429");
    }

    public static RateLimitedException noPermit(String dependency) {
        return new RateLimitedException("No rate limit permit available for " + dependency);
    }
}
