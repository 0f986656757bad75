package com.climbassessment.common.scoring;

import com.climbassessment.common.model.RawSignal;

/** Maps a raw signal to an unclamped 0–100 score. */
@FunctionalInterface
public interface ScoreFunction {
    double score(RawSignal signal);
}
