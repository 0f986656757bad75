package com.climbassessment.common.descent;

/**
 * Thresholds of the descent analyzer. Speeds in normalised image units per
 * second, distances in normalised image units.
 *
 * @param descentVelocity centre-of-mass downward speed that opens a descent episode
 * @param minDrop         smallest total drop reported as a descent
 * @param controlledRatio peak over mean downward speed at or above which a descent is a fall
 * @param grabVelocity    upward hand speed relative to the centre of mass that marks a grab
 */
public record DescentThresholds(
    double descentVelocity,
    double minDrop,
    double controlledRatio,
    double grabVelocity
) {
    public DescentThresholds {
        if (descentVelocity <= 0 || minDrop <= 0 || controlledRatio < 1.0 || grabVelocity <= 0) {
            throw new IllegalArgumentException("invalid descent thresholds: velocity=" + descentVelocity
                + " minDrop=" + minDrop + " ratio=" + controlledRatio + " grab=" + grabVelocity);
        }
    }

    public static DescentThresholds defaults() {
        return new DescentThresholds(0.3, 0.1, 2.0, 0.8);
    }
}
