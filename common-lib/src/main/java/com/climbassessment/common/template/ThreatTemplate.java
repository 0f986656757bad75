package com.climbassessment.common.template;

import com.climbassessment.common.model.Side;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Text and tunables of one threat rule.
 *
 * @param text       template with placeholders ({@code {side}}, {@code {count}}, ...)
 * @param threshold  firing threshold overriding the rule's default; {@code null} keeps the default
 * @param sideLabels how {@code {side}} is rendered for each side
 */
public record ThreatTemplate(String text, Double threshold, Map<Side, String> sideLabels) {

    public static final Map<Side, String> DEFAULT_SIDE_LABELS = defaultSideLabels();

    public ThreatTemplate {
        Map<Side, String> labels = new EnumMap<>(Side.class);
        labels.putAll(DEFAULT_SIDE_LABELS);
        if (sideLabels != null) {
            sideLabels.forEach((side, label) -> {
                if (label != null && !label.isBlank()) {
                    labels.put(side, label);
                }
            });
        }
        sideLabels = Collections.unmodifiableMap(labels);
    }

    public static ThreatTemplate of(String text) {
        return new ThreatTemplate(text, null, null);
    }

    public String sideLabel(Side side) {
        return sideLabels.get(side);
    }

    private static Map<Side, String> defaultSideLabels() {
        Map<Side, String> labels = new EnumMap<>(Side.class);
        labels.put(Side.LEFT, "left");
        labels.put(Side.RIGHT, "right");
        labels.put(Side.NONE, "both");
        return Collections.unmodifiableMap(labels);
    }
}
