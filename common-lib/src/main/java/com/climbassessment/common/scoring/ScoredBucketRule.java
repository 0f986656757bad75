package com.climbassessment.common.scoring;

import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.model.RawSignal;

/**
 * Score function plus bucket lookup. The score is rounded to one decimal
 * before the lookup, so the level always agrees with the reported score.
 */
final class ScoredBucketRule implements NormalizationRule {

    private final ScoreFunction function;
    private final BucketTable buckets;

    ScoredBucketRule(ScoreFunction function, BucketTable buckets) {
        this.function = function;
        this.buckets = buckets;
    }

    @Override
    public Normalized normalize(RawSignal signal) {
        double score = Kinematics.round(ScoreFunctions.clampScore(function.score(signal)), 1);
        return new Normalized(score, buckets.lookup(score));
    }
}
