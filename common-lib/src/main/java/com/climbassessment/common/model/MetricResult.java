package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalised outcome of one category.
 *
 * @param name  category id ({@code hip_position}, ...)
 * @param score 0–100, higher is better
 * @param level bucket of the category's level family
 * @param raw   template placeholder values; always contains {@code score}
 */
public record MetricResult(
    @JsonProperty("name") String name,
    @JsonProperty("score") double score,
    @JsonProperty("level") Level level,
    @JsonProperty("raw") Map<String, Double> raw
) {
    public MetricResult {
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }
}
