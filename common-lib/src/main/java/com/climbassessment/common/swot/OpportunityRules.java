package com.climbassessment.common.swot;

import com.climbassessment.common.model.MetricCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Built-in opportunity rules, one per category. Every calculation is a small
 * closed-form function over the category's score and raw values.
 */
public final class OpportunityRules {

    private OpportunityRules() { /* utility class */ }

    public static List<OpportunityRule> standard() {
        return List.of(
            hipPosition(),
            quietFeet(),
            diagonal(),
            routeReading(),
            rhythm(),
            dynamicControl(),
            gripRelease(),
            armLoad());
    }

    /** target = min(score + 20, 85); reduction = round((target − score) · 0.6). */
    public static OpportunityRule hipPosition() {
        return rule(MetricCategory.HIP_POSITION, Set.of("score"), in -> {
            double score = in.get("score");
            double target = Math.min(Math.round(score + 20), 85);
            return values("target", target, "reduction", (double) Math.round((target - score) * 0.6));
        });
    }

    /** saved = extra repositions over the whole route; energy = 3 % per saved move, at most 30 %. */
    public static OpportunityRule quietFeet() {
        return rule(MetricCategory.QUIET_FEET, Set.of("repositions", "norm", "holds"), in -> {
            double saved = Math.max(0, Math.round((in.get("repositions") - in.get("norm")) * in.get("holds")));
            return values("saved", saved, "energy", Math.min(30.0, saved * 3));
        });
    }

    /** target = min(diagonal + 25, 90) percent of moves. */
    public static OpportunityRule diagonal() {
        return rule(MetricCategory.DIAGONAL, Set.of("diagonal"), in ->
            values("target", Math.min(in.get("diagonal") + 25, 90.0)));
    }

    /** target = max(preview + 5, 10) seconds of reading before the first move. */
    public static OpportunityRule routeReading() {
        return rule(MetricCategory.ROUTE_READING, Set.of("preview"), in ->
            values("target", (double) Math.round(Math.max(in.get("preview") + 5, 10))));
    }

    /** saved = variance / 20, kept within 5–25 %. */
    public static OpportunityRule rhythm() {
        return rule(MetricCategory.RHYTHM, Set.of("variance"), in ->
            values("saved", Math.max(5.0, Math.min(25.0, Math.round(in.get("variance") / 20.0)))));
    }

    public static OpportunityRule dynamicControl() {
        return rule(MetricCategory.DYNAMIC_CONTROL, Set.of("time"), in -> values("target", 0.5));
    }

    public static OpportunityRule gripRelease() {
        return rule(MetricCategory.GRIP_RELEASE, Set.of(), in -> Map.of());
    }

    public static OpportunityRule armLoad() {
        return rule(MetricCategory.ARM_LOAD, Set.of("leg_load"), in -> values("target", 65.0));
    }

    static OpportunityRule rule(MetricCategory category, Set<String> required,
                                Function<Map<String, Double>, Map<String, Double>> calculation) {
        return new CalculatedRule(category.id(), category, Set.copyOf(required), calculation);
    }

    private static Map<String, Double> values(String key, double value) {
        return Map.of(key, value);
    }

    private static Map<String, Double> values(String key1, double value1, String key2, double value2) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(key1, value1);
        values.put(key2, value2);
        return values;
    }

    private record CalculatedRule(
        String id,
        MetricCategory category,
        Set<String> requiredInputs,
        Function<Map<String, Double>, Map<String, Double>> calculation
    ) implements OpportunityRule {

        @Override
        public Map<String, Double> calculate(Map<String, Double> inputs) {
            return calculation.apply(inputs);
        }
    }
}
