package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bucket labels across all level families. Which labels a category may take
 * is fixed by its {@link LevelFamily}.
 */
public enum Level {
    POOR,
    MEDIUM,
    GOOD,
    EXCELLENT,
    CRITICAL,
    HIGH,
    MODERATE,
    LOW,
    OVERLOADED,
    ACCEPTABLE,
    OPTIMAL;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }

    public static Optional<Level> fromKey(String key) {
        return Arrays.stream(values())
            .filter(level -> level.key().equals(key))
            .findFirst();
    }
}
