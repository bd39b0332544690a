package com.greenwashradar.pipeline.client;

import com.greenwashradar.pipeline.exception.OracleCallException;
import com.greenwashradar.pipeline.exception.RateLimitedException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient failures of oracle calls onto the pipeline exception family.
 */
final class OracleErrorMapper {

    private OracleErrorMapper() {
    }

    static Throwable map(String oracle, Throwable e) {
        if (e instanceof WebClientResponseException wce) {
            int status = wce.getStatusCode().value();
            if (status == 429) {
                return RateLimitedException.remote(oracle);
            }
            if (wce.getStatusCode().is5xxServerError()) {
                return OracleCallException.serverError(oracle, status);
            }
            return OracleCallException.rejected(oracle, status);
        }
        if (e instanceof TimeoutException) {
            return OracleCallException.timeout(oracle, e);
        }
        if (e instanceof WebClientRequestException) {
            return new OracleCallException(oracle + " unreachable: " + e.getMessage(), true, e);
        }
        return e;
    }
}
