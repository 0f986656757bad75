package com.climbassessment.common.extractor;

import com.climbassessment.common.model.GradeBracket;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable extractor thresholds. Distances are normalised image units,
 * durations seconds.
 *
 * @param footNorms              expected repositions per foot hold, per grade bracket
 * @param holdRadius             two foot settles closer than this are the same hold
 * @param comAdvance             centre-of-mass rise after which a hold counts as passed
 * @param minFootHolds           distinct foot holds needed for quiet_feet
 * @param minClimbingFrames      frames needed by the per-frame categories
 * @param pairWindowSeconds      max gap between a hand move and the foot move it pairs with
 * @param minMovePairs           hand/foot pairs needed for diagonal
 * @param pauseCreditSeconds     planning seconds credited per mid-climb pause
 * @param restCutoffSeconds      inter-move intervals longer than this are rests
 * @param minRhythmIntervals     intervals needed for rhythm
 * @param settleTimeoutSeconds   settle time charged when a dynamic move never settles
 * @param releaseWindowSeconds   span after a hold release sampled for jerk
 * @param minReleases            measurable releases needed for grip_release
 * @param minExhaustionFrames    frames with a centre of mass needed for exhaustion
 */
public record ExtractorConfig(
    Map<GradeBracket, Double> footNorms,
    double holdRadius,
    double comAdvance,
    int minFootHolds,
    int minClimbingFrames,
    double pairWindowSeconds,
    int minMovePairs,
    double pauseCreditSeconds,
    double restCutoffSeconds,
    int minRhythmIntervals,
    double settleTimeoutSeconds,
    double releaseWindowSeconds,
    int minReleases,
    int minExhaustionFrames
) {
    public ExtractorConfig {
        Map<GradeBracket, Double> norms = new EnumMap<>(GradeBracket.class);
        norms.putAll(footNorms);
        for (GradeBracket bracket : GradeBracket.values()) {
            Double norm = norms.get(bracket);
            if (norm == null || norm <= 0) {
                throw new IllegalArgumentException("footNorms needs a positive norm for " + bracket.label());
            }
        }
        footNorms = Map.copyOf(norms);
    }

    public static ExtractorConfig defaults() {
        Map<GradeBracket, Double> norms = new EnumMap<>(GradeBracket.class);
        norms.put(GradeBracket.FIVE_A_TO_FIVE_C, 2.0);
        norms.put(GradeBracket.SIX_A_TO_SIX_B, 1.5);
        norms.put(GradeBracket.SIX_C_TO_SEVEN_A, 1.0);
        norms.put(GradeBracket.SEVEN_B_PLUS, 0.5);
        return new ExtractorConfig(norms, 0.03, 0.02, 2, 10,
            0.5, 3, 1.5, 5.0, 3, 3.0, 0.2, 3, 40);
    }

    public double footNorm(GradeBracket bracket) {
        return footNorms.get(bracket);
    }
}
