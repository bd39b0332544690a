package com.greenwashradar.pipeline.fetcher;

/**
 * External source of documents or articles. Calls block until the source answers.
 *
 * @param <Q> query type
 * @param <R> result type
 */
public interface SourceFetcher<Q, R> {

    /**
     * Source identifier, also used as the call-policy dependency name
     */
    String getSourceId();

    /**
     * 이 소스가 사용 가능한지 확인 (엔드포인트, API 키 설정 등)
     */
    boolean isAvailable();

    /**
     * @throws com.greenwashradar.pipeline.exception.FetchException on transient failures
     * @throws com.greenwashradar.pipeline.exception.RateLimitedException when the source answers 429
     */
    R fetch(Q query);
}
