package com.greenwashradar.pipeline.dto;

import java.util.List;

/**
 * Query strings for one topic, narrowest first. Each tier is strictly broader than the previous one.
 */
public record FallbackQuery(String topicId, List<String> tiers) {

    public FallbackQuery {
        tiers = List.copyOf(tiers);
    }

    public int size() {
        return tiers.size();
    }

    public boolean isEmpty() {
        return tiers.isEmpty();
    }
}
