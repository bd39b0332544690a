package com.greenwashradar.pipeline.service.fetch;

import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.FallbackQuery;
import com.greenwashradar.pipeline.dto.FetchOutcomeStatus;
import com.greenwashradar.pipeline.dto.NewsArticle;
import com.greenwashradar.pipeline.dto.SearchTopic;
import com.greenwashradar.pipeline.dto.TopicFetchOutcome;
import com.greenwashradar.pipeline.exception.PipelineException;
import com.greenwashradar.pipeline.fetcher.NewsFetcher;
import com.greenwashradar.pipeline.service.fallback.FallbackQueryPlanner;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the fallback search of many topics on the shared fetch pool.
 * <p>
 * Collection is best-effort: a failing topic becomes a {@code FETCH_ERROR} outcome and never
 * cancels its siblings. The result map is assembled only after every topic has reported, in
 * the order the topics were given.
 */
@Service
@Slf4j
public class ConcurrentFetchCoordinator {

    private final NewsFetcher newsFetcher;
    private final FallbackQueryPlanner planner;
    private final ExternalCallPolicy callPolicy;
    private final Executor fetchExecutor;
    private final PipelineProperties properties;

    public ConcurrentFetchCoordinator(NewsFetcher newsFetcher,
                                      FallbackQueryPlanner planner,
                                      ExternalCallPolicy callPolicy,
                                      @Qualifier("fetchExecutor") Executor fetchExecutor,
                                      PipelineProperties properties) {
        this.newsFetcher = newsFetcher;
        this.planner = planner;
        this.callPolicy = callPolicy;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public Map<String, TopicFetchOutcome> fetchAll(List<SearchTopic> topics) {
        if (topics.isEmpty()) {
            return Map.of();
        }
        long timeoutMillis = properties.getFetch().getTaskTimeout().toMillis();

        Map<String, CompletableFuture<TopicFetchOutcome>> pending = new LinkedHashMap<>();
        for (SearchTopic topic : topics) {
            if (pending.containsKey(topic.topicId())) {
                log.warn("Duplicate topic id {} ignored", topic.topicId());
                continue;
            }
            CompletableFuture<TopicFetchOutcome> future = startTimedOnWorker(topic, timeoutMillis)
                    .exceptionally(e -> {
                        String reason = describe(e);
                        log.warn("News fetch failed for topic {}: {}", topic.topicId(), reason);
                        return TopicFetchOutcome.fetchError(topic.topicId(), reason);
                    });
            pending.put(topic.topicId(), future);
        }

        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();

        Map<String, TopicFetchOutcome> outcomes = new LinkedHashMap<>();
        pending.forEach((topicId, future) -> outcomes.put(topicId, future.join()));

        long found = outcomes.values().stream().filter(TopicFetchOutcome::isFound).count();
        long errors = outcomes.values().stream()
                .filter(o -> o.status() == FetchOutcomeStatus.FETCH_ERROR)
                .count();
        log.info("News fetch finished: topics={}, found={}, noEvidence={}, errors={}",
                outcomes.size(), found, outcomes.size() - found - errors, errors);
        return outcomes;
    }

    /**
     * Queues the topic on the fetch pool. The deadline is armed when a worker picks the task
     * up, so time spent waiting in the queue does not count against it.
     */
    private CompletableFuture<TopicFetchOutcome> startTimedOnWorker(SearchTopic topic, long timeoutMillis) {
        CompletableFuture<TopicFetchOutcome> result = new CompletableFuture<>();
        fetchExecutor.execute(() -> {
            result.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
            try {
                result.complete(fetchTopic(topic));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Walks the tiers of one topic, narrowest first, stopping at the first non-empty result.
     * A failing tier ends the topic; broader tiers are only tried after an empty answer.
     */
    TopicFetchOutcome fetchTopic(SearchTopic topic) {
        FallbackQuery plan = planner.plan(topic);
        List<String> tiers = plan.tiers();
        for (int i = 0; i < tiers.size(); i++) {
            String query = tiers.get(i);
            List<NewsArticle> articles;
            try {
                articles = callPolicy.execute(newsFetcher.getSourceId(), () -> newsFetcher.fetch(query));
            } catch (PipelineException e) {
                log.warn("Tier {} search failed for topic {}: {}", i + 1, topic.topicId(), e.getMessage());
                return TopicFetchOutcome.fetchError(topic.topicId(), e.getMessage());
            }
            if (articles != null && !articles.isEmpty()) {
                log.debug("Topic {} matched at tier {} with {} articles", topic.topicId(), i + 1, articles.size());
                return TopicFetchOutcome.found(topic.topicId(), i + 1, query, articles);
            }
        }
        return TopicFetchOutcome.noEvidence(topic.topicId());
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            return "Timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
