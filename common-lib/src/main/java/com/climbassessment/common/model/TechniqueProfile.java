package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of all category results for one session.
 *
 * <p>{@code overallScore} is {@code null} and {@code grade} is
 * {@value #INDETERMINATE} when no technique category had enough data.
 * Categories listed in {@code insufficientData} are absent from {@code metrics}.
 */
public record TechniqueProfile(
    @JsonProperty("metrics") Map<String, MetricResult> metrics,
    @JsonProperty("overallScore") Double overallScore,
    @JsonProperty("grade") String grade,
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("insufficientData") List<String> insufficientData
) {
    public static final String INDETERMINATE = "indeterminate";

    public TechniqueProfile {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        insufficientData = List.copyOf(insufficientData);
    }

    @JsonIgnore
    public boolean isIndeterminate() {
        return overallScore == null;
    }

    public MetricResult metric(MetricCategory category) {
        return metrics.get(category.id());
    }
}
