package com.greenwashradar.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Result of walking the fallback tiers for one topic.
 *
 * @param tier  1-based tier that produced the articles, or 0 when none did
 */
public record TopicFetchOutcome(
        String topicId,
        FetchOutcomeStatus status,
        int tier,
        String query,
        List<NewsArticle> articles,
        String errorMessage
) {

    public TopicFetchOutcome {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }

    public static TopicFetchOutcome found(String topicId, int tier, String query, List<NewsArticle> articles) {
        return new TopicFetchOutcome(topicId, FetchOutcomeStatus.FOUND, tier, query, articles, null);
    }

    public static TopicFetchOutcome noEvidence(String topicId) {
        return new TopicFetchOutcome(topicId, FetchOutcomeStatus.NO_EVIDENCE, 0, null, List.of(), null);
    }

    public static TopicFetchOutcome fetchError(String topicId, String message) {
        return new TopicFetchOutcome(topicId, FetchOutcomeStatus.FETCH_ERROR, 0, null, List.of(), message);
    }

    @JsonIgnore
    public boolean isFound() {
        return status == FetchOutcomeStatus.FOUND;
    }
}
