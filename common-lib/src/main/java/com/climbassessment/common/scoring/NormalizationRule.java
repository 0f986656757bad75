package com.climbassessment.common.scoring;

import com.climbassessment.common.model.RawSignal;

/**
 * Fixed, deterministic mapping from a category's raw signal to its score and
 * level. Implementations are immutable.
 */
public interface NormalizationRule {

    Normalized normalize(RawSignal signal);

    /** Score function followed by a bucket lookup on the resulting score. */
    static NormalizationRule scored(ScoreFunction function, BucketTable buckets) {
        return new ScoredBucketRule(function, buckets);
    }
}
