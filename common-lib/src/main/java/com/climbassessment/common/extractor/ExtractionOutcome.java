package com.climbassessment.common.extractor;

import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running every extractor over one session: the signals that could
 * be computed and the categories that had insufficient data.
 */
public record ExtractionOutcome(
    Map<MetricCategory, RawSignal> signals,
    List<MetricCategory> insufficient
) {
    public ExtractionOutcome {
        Map<MetricCategory, RawSignal> ordered = new EnumMap<>(MetricCategory.class);
        ordered.putAll(signals);
        signals = Collections.unmodifiableMap(ordered);
        insufficient = List.copyOf(insufficient);
    }
}
