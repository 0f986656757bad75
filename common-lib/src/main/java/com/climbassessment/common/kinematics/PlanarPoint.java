package com.climbassessment.common.kinematics;

/** A point in normalised image coordinates. */
public record PlanarPoint(double x, double y) {

    public double distanceTo(PlanarPoint other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
