package com.greenwashradar.pipeline.dto;

import java.util.Locale;
import java.util.Optional;

public enum EsgCategory {
    E, S, G;

    public static Optional<EsgCategory> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "E", "ENVIRONMENT", "ENVIRONMENTAL" -> Optional.of(E);
            case "S", "SOCIAL" -> Optional.of(S);
            case "G", "GOVERNANCE" -> Optional.of(G);
            default -> Optional.empty();
        };
    }
}
