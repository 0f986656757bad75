package com.climbassessment.common.scoring;

import com.climbassessment.common.model.MetricCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable scoring configuration: one normalisation rule per category, the
 * technique-category weights and the grade table. Sessions with different
 * configurations can run side by side.
 */
public record ScoringConfig(
    Map<MetricCategory, NormalizationRule> rules,
    Map<MetricCategory, Double> weights,
    GradeTable gradeTable
) {
    private static final double WEIGHT_TOLERANCE = 1e-9;

    public ScoringConfig {
        Map<MetricCategory, NormalizationRule> ruleCopy = new EnumMap<>(MetricCategory.class);
        ruleCopy.putAll(rules);
        for (MetricCategory category : MetricCategory.values()) {
            if (!ruleCopy.containsKey(category)) {
                throw new IllegalArgumentException("no normalisation rule for " + category.id());
            }
        }

        Map<MetricCategory, Double> weightCopy = new EnumMap<>(MetricCategory.class);
        weightCopy.putAll(weights);
        double sum = 0;
        for (Map.Entry<MetricCategory, Double> entry : weightCopy.entrySet()) {
            if (!entry.getKey().isTechnique()) {
                throw new IllegalArgumentException(entry.getKey().id() + " is auxiliary and cannot carry a weight");
            }
            if (entry.getValue() <= 0) {
                throw new IllegalArgumentException("weight of " + entry.getKey().id() + " must be positive");
            }
            sum += entry.getValue();
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("weights must sum to 1.0, got " + sum);
        }

        rules = Collections.unmodifiableMap(ruleCopy);
        weights = Collections.unmodifiableMap(weightCopy);
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(defaultRules(), defaultWeights(), GradeTable.defaults());
    }

    public static Map<MetricCategory, NormalizationRule> defaultRules() {
        BucketTable generic = BucketTable.generic();
        Map<MetricCategory, NormalizationRule> rules = new EnumMap<>(MetricCategory.class);
        rules.put(MetricCategory.QUIET_FEET, NormalizationRule.scored(ScoreFunctions.quietFeet(), generic));
        rules.put(MetricCategory.HIP_POSITION, NormalizationRule.scored(ScoreFunctions.linearDecay(5.0, 2.0, 20.0), generic));
        rules.put(MetricCategory.DIAGONAL, NormalizationRule.scored(ScoreFunctions.diagonal(), generic));
        rules.put(MetricCategory.ROUTE_READING, NormalizationRule.scored(ScoreFunctions.saturating(20.0, 80.0, 6.0), generic));
        rules.put(MetricCategory.RHYTHM, NormalizationRule.scored(ScoreFunctions.rhythm(), generic));
        rules.put(MetricCategory.DYNAMIC_CONTROL, NormalizationRule.scored(ScoreFunctions.linearDecay(0.3, 60.0, 15.0), generic));
        rules.put(MetricCategory.GRIP_RELEASE, NormalizationRule.scored(ScoreFunctions.exponentialDecay(8.0, 15.0), generic));
        rules.put(MetricCategory.EXHAUSTION, NormalizationRule.scored(ScoreFunctions.inversePercent(), BucketTable.exhaustion()));
        rules.put(MetricCategory.ARM_LOAD, BandedRule.armLoad());
        return rules;
    }

    public static Map<MetricCategory, Double> defaultWeights() {
        Map<MetricCategory, Double> weights = new EnumMap<>(MetricCategory.class);
        weights.put(MetricCategory.QUIET_FEET, 0.20);
        weights.put(MetricCategory.HIP_POSITION, 0.20);
        weights.put(MetricCategory.DIAGONAL, 0.15);
        weights.put(MetricCategory.GRIP_RELEASE, 0.15);
        weights.put(MetricCategory.RHYTHM, 0.10);
        weights.put(MetricCategory.DYNAMIC_CONTROL, 0.10);
        weights.put(MetricCategory.ROUTE_READING, 0.10);
        return weights;
    }

    public ScoringConfig withRule(MetricCategory category, NormalizationRule rule) {
        Map<MetricCategory, NormalizationRule> copy = new EnumMap<>(MetricCategory.class);
        copy.putAll(rules);
        copy.put(category, rule);
        return new ScoringConfig(copy, weights, gradeTable);
    }

    public ScoringConfig withWeights(Map<MetricCategory, Double> newWeights) {
        return new ScoringConfig(rules, newWeights, gradeTable);
    }

    public NormalizationRule rule(MetricCategory category) {
        return rules.get(category);
    }
}
