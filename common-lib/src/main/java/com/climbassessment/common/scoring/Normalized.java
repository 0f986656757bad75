package com.climbassessment.common.scoring;

import com.climbassessment.common.model.Level;

/** Score and bucket assigned to one raw signal. */
public record Normalized(double score, Level level) {}
