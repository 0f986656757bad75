package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One landmark observation in normalised image coordinates (y grows downward).
 * {@code z} is optional depth relative to the hips; {@code null} for 2-D providers.
 */
public record Landmark(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y,
    @JsonProperty("z") Double z,
    @JsonProperty("confidence") double confidence
) {
    public static Landmark of(double x, double y, double confidence) {
        return new Landmark(x, y, null, confidence);
    }

    public static Landmark of(double x, double y, double z, double confidence) {
        return new Landmark(x, y, z, confidence);
    }

    /** True when all coordinates are finite and confidence lies in [0, 1]. */
    @JsonIgnore
    public boolean isPhysical() {
        return Double.isFinite(x) && Double.isFinite(y)
            && (z == null || Double.isFinite(z))
            && confidence >= 0.0 && confidence <= 1.0;
    }
}
