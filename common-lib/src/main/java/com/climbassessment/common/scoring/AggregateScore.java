package com.climbassessment.common.scoring;

import java.util.Map;

/**
 * @param overall weighted overall score, {@code null} when no weighted category was scored
 * @param weights effective (renormalised) weights keyed by category id
 */
public record AggregateScore(Double overall, Map<String, Double> weights) {}
