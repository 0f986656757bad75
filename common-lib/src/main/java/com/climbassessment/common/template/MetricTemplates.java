package com.climbassessment.common.template;

import com.climbassessment.common.model.Level;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Level texts of one metric, covering every level of the metric's family. */
public record MetricTemplates(Map<Level, LevelTexts> levels) {

    public MetricTemplates {
        Map<Level, LevelTexts> copy = new EnumMap<>(Level.class);
        copy.putAll(levels);
        levels = Collections.unmodifiableMap(copy);
    }

    /** Non-blank text for {@code level} and {@code field}, if the template defines one. */
    public Optional<String> text(Level level, TextField field) {
        LevelTexts texts = levels.get(level);
        if (texts == null) return Optional.empty();
        String text = texts.get(field);
        return LevelTexts.isBlank(text) ? Optional.empty() : Optional.of(text);
    }
}
