package com.climbassessment.common.kinematics;

import com.climbassessment.common.buffer.JointSample;

import java.util.List;

/**
 * Stateless numeric helpers shared by the feature extractors and the tension
 * analyzer. All angles are in degrees; all positions are normalised image
 * coordinates.
 *
 * <p>Methods return {@code NaN} rather than throwing when an input sample is
 * not usable, so callers can skip the interval.
 */
public final class Kinematics {

    private Kinematics() { /* utility class */ }

    // ── Positions & velocities ─────────────────────────────────────

    public static double distance(JointSample a, JointSample b) {
        if (!a.isUsable() || !b.isUsable()) return Double.NaN;
        return Math.hypot(a.x() - b.x(), a.y() - b.y());
    }

    /** Speed between two consecutive samples in units per second. */
    public static double speed(JointSample from, JointSample to) {
        double dt = to.timestamp() - from.timestamp();
        if (dt <= 0) return Double.NaN;
        return distance(from, to) / dt;
    }

    /**
     * Magnitude of the discrete second derivative of position over three
     * consecutive samples, in units per second squared.
     */
    public static double acceleration(JointSample a, JointSample b, JointSample c) {
        if (!a.isUsable() || !b.isUsable() || !c.isUsable()) return Double.NaN;
        double dt1 = b.timestamp() - a.timestamp();
        double dt2 = c.timestamp() - b.timestamp();
        if (dt1 <= 0 || dt2 <= 0) return Double.NaN;
        double vx1 = (b.x() - a.x()) / dt1;
        double vy1 = (b.y() - a.y()) / dt1;
        double vx2 = (c.x() - b.x()) / dt2;
        double vy2 = (c.y() - b.y()) / dt2;
        double dt = (dt1 + dt2) / 2.0;
        return Math.hypot(vx2 - vx1, vy2 - vy1) / dt;
    }

    // ── Angles ─────────────────────────────────────────────────────

    /** Angle at {@code vertex} formed by {@code a}–{@code vertex}–{@code c}, in [0, 180]. */
    public static double angleAt(JointSample a, JointSample vertex, JointSample c) {
        if (!a.isUsable() || !vertex.isUsable() || !c.isUsable()) return Double.NaN;
        return angleAt(new PlanarPoint(a.x(), a.y()),
                       new PlanarPoint(vertex.x(), vertex.y()),
                       new PlanarPoint(c.x(), c.y()));
    }

    public static double angleAt(PlanarPoint a, PlanarPoint vertex, PlanarPoint c) {
        double bax = a.x() - vertex.x();
        double bay = a.y() - vertex.y();
        double bcx = c.x() - vertex.x();
        double bcy = c.y() - vertex.y();
        double norm = Math.hypot(bax, bay) * Math.hypot(bcx, bcy);
        if (norm == 0) return Double.NaN;
        double cosine = (bax * bcx + bay * bcy) / norm;
        return Math.toDegrees(Math.acos(clamp(cosine, -1.0, 1.0)));
    }

    /**
     * Unsigned angle between the lines {@code a1→a2} and {@code b1→b2},
     * folded into [0, 90].
     */
    public static double lineAngle(JointSample a1, JointSample a2, JointSample b1, JointSample b2) {
        if (!a1.isUsable() || !a2.isUsable() || !b1.isUsable() || !b2.isUsable()) return Double.NaN;
        double first = Math.atan2(a2.y() - a1.y(), a2.x() - a1.x());
        double second = Math.atan2(b2.y() - b1.y(), b2.x() - b1.x());
        double diff = Math.abs(Math.toDegrees(first - second)) % 180.0;
        return diff > 90.0 ? 180.0 - diff : diff;
    }

    // ── Statistics ─────────────────────────────────────────────────

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return Double.NaN;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    /** Population standard deviation. */
    public static double stdDev(List<Double> values) {
        if (values == null || values.isEmpty()) return Double.NaN;
        double mean = mean(values);
        double sq = 0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / values.size());
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
