package com.climbassessment.common.tension;

/**
 * Per-region thresholds of the tension analyzer. Angles in degrees, lateral
 * offset in normalised image units.
 */
public record TensionThresholds(
    double elbowLockBelow,
    double shoulderLockAbove,
    double kneeLateralAbove,
    double kneeAngleMin,
    double kneeAngleMax,
    double twistAbove
) {
    public static TensionThresholds defaults() {
        return new TensionThresholds(70.0, 150.0, 0.15, 30.0, 50.0, 30.0);
    }
}
