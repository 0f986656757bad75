package com.climbassessment.common.template;

import com.climbassessment.common.model.Level;
import com.climbassessment.common.model.MetricCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated template set. Loaded once per process and shared
 * read-only by every session.
 *
 * <p>Every category has a metric entry; opportunity and threat texts are keyed
 * by rule id.
 */
public final class TemplateSet {

    private final Map<MetricCategory, MetricTemplates> metrics;
    private final Map<String, String> opportunities;
    private final Map<String, ThreatTemplate> threats;

    public TemplateSet(Map<MetricCategory, MetricTemplates> metrics,
                       Map<String, String> opportunities,
                       Map<String, ThreatTemplate> threats) {
        Map<MetricCategory, MetricTemplates> metricCopy = new EnumMap<>(MetricCategory.class);
        metricCopy.putAll(metrics);
        this.metrics = Collections.unmodifiableMap(metricCopy);
        this.opportunities = Collections.unmodifiableMap(new LinkedHashMap<>(opportunities));
        this.threats = Collections.unmodifiableMap(new LinkedHashMap<>(threats));
    }

    public Optional<String> metricText(MetricCategory category, Level level, TextField field) {
        MetricTemplates templates = metrics.get(category);
        return templates == null ? Optional.empty() : templates.text(level, field);
    }

    public Optional<String> opportunityText(String ruleId) {
        return Optional.ofNullable(opportunities.get(ruleId));
    }

    public Optional<ThreatTemplate> threat(String ruleId) {
        return Optional.ofNullable(threats.get(ruleId));
    }

    public Map<MetricCategory, MetricTemplates> metrics() { return metrics; }

    public Map<String, String> opportunities() { return opportunities; }

    public Map<String, ThreatTemplate> threats() { return threats; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemplateSet other)) return false;
        return metrics.equals(other.metrics)
            && opportunities.equals(other.opportunities)
            && threats.equals(other.threats);
    }

    @Override
    public int hashCode() {
        return metrics.hashCode() * 31 * 31 + opportunities.hashCode() * 31 + threats.hashCode();
    }
}
