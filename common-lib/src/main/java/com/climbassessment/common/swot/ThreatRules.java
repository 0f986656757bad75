package com.climbassessment.common.swot;

import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.model.BodyRegion;
import com.climbassessment.common.model.DescentEvent;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.MetricResult;
import com.climbassessment.common.model.Side;
import com.climbassessment.common.model.TensionEvent;
import com.climbassessment.common.model.TensionKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Built-in threat rules.
 *
 * <pre>
 *   shoulder            shoulder angle-lock count  ≥ 3
 *   elbow               elbow angle-lock count     ≥ 5
 *   knee_rotation       knee rotation count        ≥ 2
 *   lower_back          maximum trunk twist        ≥ 30°
 *   exhaustion_critical quality degradation        ≥ 70 %
 *   fall                uncontrolled descents      ≥ 1
 * </pre>
 */
public final class ThreatRules {

    private ThreatRules() { /* utility class */ }

    public static List<ThreatRule> standard() {
        return List.of(
            new TensionCountRule("shoulder", BodyRegion.SHOULDER, TensionKind.ANGLE_LOCK, 3, Math::max),
            new TensionCountRule("elbow", BodyRegion.ELBOW, TensionKind.ANGLE_LOCK, 5, Math::min),
            new TensionCountRule("knee_rotation", BodyRegion.KNEE, TensionKind.ROTATION, 2, Math::max),
            new TwistRule(),
            new ExhaustionRule(),
            new FallRule());
    }

    /**
     * Fires when either side reaches the count threshold. The side with more
     * crossings is reported; equal counts are reported as {@link Side#NONE}.
     */
    static final class TensionCountRule implements ThreatRule {

        private final String id;
        private final BodyRegion region;
        private final TensionKind kind;
        private final double threshold;
        private final BinaryOperator<Double> moreExtreme;

        TensionCountRule(String id, BodyRegion region, TensionKind kind, double threshold,
                         BinaryOperator<Double> moreExtreme) {
            this.id = id;
            this.region = region;
            this.kind = kind;
            this.threshold = threshold;
            this.moreExtreme = moreExtreme;
        }

        @Override
        public String id() { return id; }

        @Override
        public double defaultThreshold() { return threshold; }

        @Override
        public Optional<ThreatFinding> evaluate(ThreatInputs inputs, double threshold) {
            TensionEvent left = null;
            TensionEvent right = null;
            for (TensionEvent event : inputs.tensionEvents()) {
                if (event.region() != region || event.kind() != kind) continue;
                if (event.side() == Side.LEFT) left = event;
                else if (event.side() == Side.RIGHT) right = event;
            }
            int leftCount = left == null ? 0 : left.count();
            int rightCount = right == null ? 0 : right.count();
            int count = Math.max(leftCount, rightCount);
            if (count == 0 || count < threshold) {
                return Optional.empty();
            }

            Side side;
            double extremum;
            if (leftCount > rightCount) {
                side = Side.LEFT;
                extremum = left.extremum();
            } else if (rightCount > leftCount) {
                side = Side.RIGHT;
                extremum = right.extremum();
            } else {
                side = Side.NONE;
                extremum = moreExtreme.apply(left.extremum(), right.extremum());
            }

            Map<String, Double> values = new LinkedHashMap<>();
            values.put("count", (double) count);
            values.put("angle", extremum);
            return Optional.of(new ThreatFinding(id, count, side, values));
        }
    }

    static final class TwistRule implements ThreatRule {

        @Override
        public String id() { return "lower_back"; }

        @Override
        public double defaultThreshold() { return 30.0; }

        @Override
        public Optional<ThreatFinding> evaluate(ThreatInputs inputs, double threshold) {
            return inputs.tensionEvents().stream()
                .filter(e -> e.region() == BodyRegion.LOWER_BACK && e.kind() == TensionKind.TWIST)
                .filter(e -> e.extremum() >= threshold)
                .findFirst()
                .map(e -> new ThreatFinding(id(), e.extremum(), Side.NONE,
                    Map.of("angle", (double) Math.round(e.extremum()), "count", (double) e.count())));
        }
    }

    static final class ExhaustionRule implements ThreatRule {

        @Override
        public String id() { return "exhaustion_critical"; }

        @Override
        public double defaultThreshold() { return 70.0; }

        @Override
        public Optional<ThreatFinding> evaluate(ThreatInputs inputs, double threshold) {
            MetricResult exhaustion = inputs.profile().metric(MetricCategory.EXHAUSTION);
            if (exhaustion == null) {
                return Optional.empty();
            }
            Double percent = exhaustion.raw().get("percent");
            if (percent == null || percent < threshold) {
                return Optional.empty();
            }
            return Optional.of(new ThreatFinding(id(), percent, Side.NONE, Map.of("percent", percent)));
        }
    }

    /**
     * Fires when the number of falls reaches the threshold. Severity is the
     * largest fall's drop in percent of the frame height; the first fall's
     * start time is reported.
     */
    static final class FallRule implements ThreatRule {

        @Override
        public String id() { return "fall"; }

        @Override
        public double defaultThreshold() { return 1.0; }

        @Override
        public Optional<ThreatFinding> evaluate(ThreatInputs inputs, double threshold) {
            List<DescentEvent> falls = inputs.descents().stream()
                .filter(DescentEvent::isFall)
                .toList();
            if (falls.isEmpty() || falls.size() < threshold) {
                return Optional.empty();
            }
            double drop = falls.stream().mapToDouble(DescentEvent::drop).max().orElse(0.0) * 100.0;

            Map<String, Double> values = new LinkedHashMap<>();
            values.put("count", (double) falls.size());
            values.put("drop", (double) Math.round(drop));
            values.put("time", Kinematics.round(falls.get(0).start(), 1));
            return Optional.of(new ThreatFinding(id(), drop, Side.NONE, values));
        }
    }
}
