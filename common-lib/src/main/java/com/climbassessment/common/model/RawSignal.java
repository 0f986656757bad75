package com.climbassessment.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kinematic measurement produced by a feature extractor, before normalisation.
 *
 * @param category     category the signal belongs to
 * @param value        the measurement the category's normalisation rule consumes
 * @param placeholders named values available to text templates
 */
public record RawSignal(
    MetricCategory category,
    double value,
    Map<String, Double> placeholders
) {
    public RawSignal {
        placeholders = placeholders == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(placeholders));
    }

    public static RawSignal of(MetricCategory category, double value, Map<String, Double> placeholders) {
        return new RawSignal(category, value, placeholders);
    }
}
