package com.climbassessment.common.scoring;

import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.MetricResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted overall score over the technique categories that were scored.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Keep the configured weights of the categories present in {@code results};
 *       auxiliary and insufficient categories carry no weight.</li>
 *   <li>Renormalise the kept weights so they sum to 1.0.</li>
 *   <li>{@code overall = Σ(weight × score)}, rounded to one decimal.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class WeightedScoreAggregator {

    private final Map<MetricCategory, Double> weights;

    public WeightedScoreAggregator(Map<MetricCategory, Double> weights) {
        this.weights = weights;
    }

    public AggregateScore aggregate(Map<MetricCategory, MetricResult> results) {
        Map<MetricCategory, Double> present = new LinkedHashMap<>();
        double totalWeight = 0.0;
        for (Map.Entry<MetricCategory, Double> entry : weights.entrySet()) {
            if (results.containsKey(entry.getKey())) {
                present.put(entry.getKey(), entry.getValue());
                totalWeight += entry.getValue();
            }
        }
        if (present.isEmpty() || totalWeight <= 0.0) {
            return new AggregateScore(null, Map.of());
        }

        Map<String, Double> effective = new LinkedHashMap<>();
        double weightedSum = 0.0;
        for (Map.Entry<MetricCategory, Double> entry : present.entrySet()) {
            double weight = entry.getValue() / totalWeight;
            effective.put(entry.getKey().id(), weight);
            weightedSum += weight * results.get(entry.getKey()).score();
        }
        return new AggregateScore(Kinematics.round(weightedSum, 1), Collections.unmodifiableMap(effective));
    }
}
