package com.climbassessment.common.scoring;

import com.climbassessment.common.model.MetricResult;
import com.climbassessment.common.model.RawSignal;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies a category's normalisation rule to its raw signal and assembles the
 * {@link MetricResult}. The result's {@code raw} mapping holds {@code score}
 * followed by the extractor's placeholders.
 */
public final class CategoryScorer {

    private final ScoringConfig config;

    public CategoryScorer(ScoringConfig config) {
        this.config = config;
    }

    public MetricResult score(RawSignal signal) {
        Normalized normalized = config.rule(signal.category()).normalize(signal);

        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("score", normalized.score());
        raw.putAll(signal.placeholders());
        return new MetricResult(signal.category().id(), normalized.score(), normalized.level(), raw);
    }
}
