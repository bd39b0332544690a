package com.greenwashradar.pipeline.service.fetch;

import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.FetchOutcomeStatus;
import com.greenwashradar.pipeline.dto.NewsArticle;
import com.greenwashradar.pipeline.dto.SearchTopic;
import com.greenwashradar.pipeline.dto.TopicFetchOutcome;
import com.greenwashradar.pipeline.exception.FetchException;
import com.greenwashradar.pipeline.service.fallback.FallbackQueryPlanner;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import com.greenwashradar.pipeline.support.PipelineTestProperties;
import com.greenwashradar.pipeline.support.ScriptedNewsFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.stream.IntStream;

import static com.greenwashradar.pipeline.support.ScriptedNewsFetcher.article;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * ConcurrentFetchCoordinator 단위 테스트
 */
class ConcurrentFetchCoordinatorTest {

    private PipelineProperties properties;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = PipelineTestProperties.fast(1, 100);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ConcurrentFetchCoordinator coordinator(ScriptedNewsFetcher fetcher) {
        return new ConcurrentFetchCoordinator(fetcher, new FallbackQueryPlanner(properties),
                new ExternalCallPolicy(properties), executor, properties);
    }

    private static SearchTopic topic(String id, String phrase) {
        return new SearchTopic(id, "Taiwan Cement", "Cement", 2024, phrase, "emissions");
    }

    @Test
    @DisplayName("결과가 나온 첫 단계에서 멈추고 더 넓은 단계는 조회하지 않음")
    void stopsAtFirstNonEmptyTier() {
        // given
        Function<String, List<NewsArticle>> script = query -> query.contains("emissions 2024")
                ? List.of(article("https://news.example.com/tier2"))
                : List.of();
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(script);

        // when
        Map<String, TopicFetchOutcome> outcomes = coordinator(fetcher).fetchAll(List.of(topic("C1", "kiln upgrade")));

        // then
        TopicFetchOutcome outcome = outcomes.get("C1");
        assertThat(outcome.status()).isEqualTo(FetchOutcomeStatus.FOUND);
        assertThat(outcome.tier()).isEqualTo(2);
        assertThat(outcome.query()).isEqualTo("Taiwan Cement Cement emissions 2024");
        assertThat(fetcher.queries()).containsExactly(
                "Taiwan Cement \"kiln upgrade\" 2024",
                "Taiwan Cement Cement emissions 2024");
    }

    @Test
    @DisplayName("모든 단계가 비면 NO_EVIDENCE")
    void reportsNoEvidenceAfterAllTiers() {
        // given
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(query -> List.of());

        // when
        Map<String, TopicFetchOutcome> outcomes = coordinator(fetcher).fetchAll(List.of(topic("C1", "kiln upgrade")));

        // then
        assertThat(outcomes.get("C1").status()).isEqualTo(FetchOutcomeStatus.NO_EVIDENCE);
        assertThat(fetcher.queries()).hasSize(3);
    }

    @Test
    @DisplayName("일부 토픽이 실패해도 나머지 결과를 모두 반환하고 입력 순서를 유지")
    void isolatesFailingTopics() {
        // given
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(query -> {
            if (query.contains("broken")) {
                throw FetchException.serverError("news-search", 502);
            }
            return List.of(article("https://news.example.com/" + Math.abs(query.hashCode())));
        });
        List<SearchTopic> topics = List.of(
                topic("C1", "phrase one"),
                topic("C2", "broken phrase two"),
                topic("C3", "phrase three"),
                topic("C4", "broken phrase four"),
                topic("C5", "phrase five"));

        // when
        Map<String, TopicFetchOutcome> outcomes = coordinator(fetcher).fetchAll(topics);

        // then
        assertThat(outcomes).containsOnlyKeys("C1", "C2", "C3", "C4", "C5");
        assertThat(outcomes.keySet()).containsExactly("C1", "C2", "C3", "C4", "C5");
        assertThat(outcomes.values()).filteredOn(TopicFetchOutcome::isFound).hasSize(3);
        assertThat(outcomes.get("C2").status()).isEqualTo(FetchOutcomeStatus.FETCH_ERROR);
        assertThat(outcomes.get("C4").status()).isEqualTo(FetchOutcomeStatus.FETCH_ERROR);
        assertThat(outcomes.get("C2").errorMessage()).contains("502");
    }

    @Test
    @DisplayName("시간 제한을 넘긴 토픽은 FETCH_ERROR로 기록하고 나머지는 정상 처리")
    void timesOutSlowTopics() {
        // given
        properties.getFetch().setTaskTimeout(Duration.ofMillis(300));
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(query -> {
            if (query.contains("slow")) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return List.of(article("https://news.example.com/fast"));
        });

        // when
        long started = System.currentTimeMillis();
        Map<String, TopicFetchOutcome> outcomes = coordinator(fetcher)
                .fetchAll(List.of(topic("C1", "slow phrase"), topic("C2", "fast phrase")));

        // then
        assertThat(System.currentTimeMillis() - started).isLessThan(3_000);
        assertThat(outcomes.get("C1").status()).isEqualTo(FetchOutcomeStatus.FETCH_ERROR);
        assertThat(outcomes.get("C1").errorMessage()).isEqualTo("Timed out");
        assertThat(outcomes.get("C2").isFound()).isTrue();
    }

    @Test
    @DisplayName("토픽 수가 풀 크기보다 많아도 모두 처리")
    void handlesMoreTopicsThanWorkers() {
        // given
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(query -> List.of(article("https://news.example.com/x")));
        List<SearchTopic> topics = IntStream.rangeClosed(1, 20)
                .mapToObj(i -> topic("C" + i, "phrase " + i))
                .toList();

        // when
        Map<String, TopicFetchOutcome> outcomes = coordinator(fetcher).fetchAll(topics);

        // then
        assertThat(outcomes).hasSize(20);
        assertThat(outcomes.values()).allMatch(o -> o.tier() == 1);
    }

    @Test
    @DisplayName("큐에서 기다린 시간은 토픽별 시간 제한에 포함하지 않음")
    void queueWaitDoesNotCountAgainstTimeout() {
        // given
        executor.shutdownNow();
        executor = Executors.newSingleThreadExecutor();
        properties.getFetch().setTaskTimeout(Duration.ofMillis(500));
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(query -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(article("https://news.example.com/" + query.hashCode()));
        });

        // when
        Map<String, TopicFetchOutcome> outcomes = coordinator(fetcher)
                .fetchAll(List.of(topic("C1", "first"), topic("C2", "second"), topic("C3", "third")));

        // then
        assertThat(outcomes.values()).extracting(TopicFetchOutcome::status)
                .containsExactly(FetchOutcomeStatus.FOUND, FetchOutcomeStatus.FOUND, FetchOutcomeStatus.FOUND);
        assertThat(fetcher.queries()).hasSize(3);
    }

    @Test
    @DisplayName("빈 토픽 목록은 빈 결과")
    void emptyTopicsYieldEmptyResult() {
        ScriptedNewsFetcher fetcher = new ScriptedNewsFetcher(query -> List.of());

        assertThat(coordinator(fetcher).fetchAll(List.of())).isEmpty();
        assertThat(fetcher.queries()).isEmpty();
    }
}
