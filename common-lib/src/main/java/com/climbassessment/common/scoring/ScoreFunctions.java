package com.climbassessment.common.scoring;

/**
 * Default score functions of the built-in categories. Each returns an
 * unclamped value; {@link #clampScore} is applied by the rule.
 */
public final class ScoreFunctions {

    private ScoreFunctions() { /* utility class */ }

    public static double clampScore(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(100.0, score));
    }

    /** Deviation from the grade norm: at or below the norm 90–100, above it decays 40 per unit. */
    public static ScoreFunction quietFeet() {
        return signal -> {
            double deviation = signal.value();
            if (deviation <= 0) {
                return 90.0 + 10.0 * Math.min(1.0, -deviation);
            }
            return Math.max(20.0, 90.0 - 40.0 * deviation);
        };
    }

    /** 100 up to {@code freeUpTo}, then minus {@code perUnit} per unit, never below {@code floor}. */
    public static ScoreFunction linearDecay(double freeUpTo, double perUnit, double floor) {
        return signal -> Math.max(floor, 100.0 - perUnit * Math.max(0.0, signal.value() - freeUpTo));
    }

    /** Diagonal fraction with a sway penalty of at most 20 points; floor 10. */
    public static ScoreFunction diagonal() {
        return signal -> {
            double sway = signal.placeholders().getOrDefault("sway", 0.0);
            double penalty = Math.min(20.0, 200.0 * sway);
            return Math.max(10.0, 100.0 * signal.value() - penalty);
        };
    }

    /** {@code floor + span · (1 − e^(−value/scale))}: more planning, diminishing returns. */
    public static ScoreFunction saturating(double floor, double span, double scale) {
        return signal -> floor + span * (1.0 - Math.exp(-signal.value() / scale));
    }

    /** Piecewise inverse mapping of interval spread in milliseconds; floor 20. */
    public static ScoreFunction rhythm() {
        return signal -> {
            double spread = signal.value();
            if (spread <= 100) return 90.0 + (100 - spread) * 0.1;
            if (spread <= 200) return 70.0 + (200 - spread) * 0.2;
            if (spread <= 350) return 50.0 + (350 - spread) * 0.133;
            return Math.max(20.0, 50.0 - (spread - 350) * 0.143);
        };
    }

    /** {@code 100 · e^(−value/scale)}, never below {@code floor}. */
    public static ScoreFunction exponentialDecay(double scale, double floor) {
        return signal -> Math.max(floor, 100.0 * Math.exp(-signal.value() / scale));
    }

    /** {@code 100 − value}; used for percentages where less is better. */
    public static ScoreFunction inversePercent() {
        return signal -> 100.0 - signal.value();
    }
}
