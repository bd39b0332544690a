package com.greenwashradar.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings of the verification pipeline, bound from {@code pipeline.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    /**
     * Archived jobs older than this are purged by the cleanup scheduler.
     */
    private int retentionDays = 30;

    private Checkpoint checkpoint = new Checkpoint();

    private Fetch fetch = new Fetch();

    private Fallback fallback = new Fallback();

    private Analysis analysis = new Analysis();

    private Executor executor = new Executor();

    /**
     * Call policy used for any dependency without its own entry in {@link #calls}.
     */
    private CallSettings defaults = new CallSettings();

    /**
     * Per-dependency call policy, keyed by dependency name (scoring-oracle, news-search, ...).
     */
    private Map<String, CallSettings> calls = new HashMap<>();

    public CallSettings callSettings(String dependency) {
        return calls.getOrDefault(dependency, defaults);
    }

    @Data
    public static class Checkpoint {
        /** jpa or memory */
        private String store = "jpa";
    }

    @Data
    public static class Fetch {
        /** Worker threads shared by every job's news searches. */
        private int poolSize = 8;

        /** Tasks waiting for a worker before submitters run the task themselves. */
        private int queueCapacity = 200;

        /** Upper bound for one topic, all tiers included. */
        private Duration taskTimeout = Duration.ofSeconds(60);

        /** Articles requested per search query. */
        private int articlesPerQuery = 5;

        /** Evidence items kept per claim out of the found articles. */
        private int evidencePerClaim = 1;
    }

    @Data
    public static class Fallback {
        /** Claim phrases are cut to this many characters before quoting. */
        private int maxPhraseLength = 50;

        /** Append the reporting year to the narrower tiers. */
        private boolean includeYear = true;
    }

    @Data
    public static class Analysis {
        /** Topic framework the oracle is asked to classify claims against. */
        private String framework = "SASB";

        /**
         * Extraction output with more items than unique topics times this factor is rejected
         * as repetitive. 0 disables the check.
         */
        private int abnormalItemsPerTopic = 2;

        /** Maximum wait for the side artifact once claim extraction is done. */
        private Duration sideArtifactTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Executor {
        private int jobPoolSize = 4;
        private int jobQueueCapacity = 100;
        private int stagePoolSize = 4;
    }

    @Data
    public static class CallSettings {
        /** Attempts including the first call. */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofSeconds(2);

        private double backoffMultiplier = 2.0;

        /** Consecutive failures that open the circuit. */
        private int failureThreshold = 5;

        /** How long an open circuit rejects calls before probing again. */
        private Duration openDuration = Duration.ofSeconds(60);

        /** Calls allowed per refresh period across all jobs. 0 means unlimited. */
        private int rateLimitPerPeriod = 0;

        private Duration rateLimitPeriod = Duration.ofMinutes(1);

        /** How long a caller may wait for a rate limit permit. */
        private Duration rateLimitWait = Duration.ofSeconds(30);
    }
}
