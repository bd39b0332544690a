package com.greenwashradar.pipeline.client;

import com.greenwashradar.pipeline.dto.OracleRequest;

/**
 * Remote LLM that extracts and scores claims. Returns the raw answer text.
 * Implementations throw {@link com.greenwashradar.pipeline.exception.OracleCallException} or
 * {@link com.greenwashradar.pipeline.exception.RateLimitedException}; they never retry themselves.
 */
public interface ScoringOracle {

    String complete(OracleRequest request);
}
