package com.greenwashradar.pipeline.support;

import com.greenwashradar.pipeline.config.PipelineProperties;

import java.time.Duration;

/**
 * Pipeline settings with millisecond backoffs so retry tests do not sleep.
 */
public final class PipelineTestProperties {

    private PipelineTestProperties() {
    }

    public static PipelineProperties fast(int maxAttempts, int failureThreshold) {
        PipelineProperties properties = new PipelineProperties();
        PipelineProperties.CallSettings defaults = properties.getDefaults();
        defaults.setMaxAttempts(maxAttempts);
        defaults.setInitialBackoff(Duration.ofMillis(1));
        defaults.setBackoffMultiplier(1.5);
        defaults.setFailureThreshold(failureThreshold);
        defaults.setOpenDuration(Duration.ofSeconds(30));
        return properties;
    }
}
