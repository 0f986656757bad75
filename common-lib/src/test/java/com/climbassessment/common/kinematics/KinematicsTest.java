package com.climbassessment.common.kinematics;

import com.climbassessment.common.buffer.JointSample;
import com.climbassessment.common.buffer.SampleState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KinematicsTest {

    private static JointSample at(double t, double x, double y) {
        return new JointSample(Math.round(t * 30), t, x, y, null, 0.9, SampleState.OBSERVED);
    }

    private static JointSample lost(double t) {
        return new JointSample(Math.round(t * 30), t, Double.NaN, Double.NaN, null, 0.0, SampleState.LOST);
    }

    @Test
    @DisplayName("3-4-5 displacement over half a second → speed 10")
    void speed() {
        assertEquals(10.0, Kinematics.speed(at(0.0, 0.0, 0.0), at(0.5, 3.0, 4.0)), 1e-9);
    }

    @Test
    @DisplayName("lost sample or non-increasing time → NaN")
    void unusableInputs() {
        assertTrue(Double.isNaN(Kinematics.speed(at(0.0, 0.1, 0.1), lost(0.1))));
        assertTrue(Double.isNaN(Kinematics.speed(at(0.2, 0.1, 0.1), at(0.2, 0.3, 0.1))));
        assertTrue(Double.isNaN(Kinematics.acceleration(at(0.0, 0, 0), lost(0.1), at(0.2, 0, 0))));
    }

    @Test
    @DisplayName("constant velocity → zero acceleration; a kink → positive")
    void acceleration() {
        assertEquals(0.0, Kinematics.acceleration(at(0.0, 0.0, 0.0), at(0.1, 0.1, 0.0), at(0.2, 0.2, 0.0)), 1e-9);
        assertEquals(100.0, Kinematics.acceleration(at(0.0, 0.0, 0.0), at(0.1, 0.0, 0.0), at(0.2, 1.0, 0.0)), 1e-9);
    }

    @Test
    @DisplayName("right angle at the vertex → 90°; coincident points → NaN")
    void angleAt() {
        PlanarPoint vertex = new PlanarPoint(0.5, 0.5);
        assertEquals(90.0, Kinematics.angleAt(new PlanarPoint(0.5, 0.2), vertex, new PlanarPoint(0.9, 0.5)), 1e-9);
        assertEquals(180.0, Kinematics.angleAt(new PlanarPoint(0.2, 0.5), vertex, new PlanarPoint(0.9, 0.5)), 1e-9);
        assertTrue(Double.isNaN(Kinematics.angleAt(vertex, vertex, new PlanarPoint(0.9, 0.5))));
    }

    @Test
    @DisplayName("line angle is folded into [0, 90] regardless of direction")
    void lineAngleFolded() {
        double parallelReversed = Kinematics.lineAngle(
            at(0, 0.4, 0.4), at(0, 0.6, 0.4), at(0, 0.6, 0.6), at(0, 0.4, 0.6));
        double fortyFive = Kinematics.lineAngle(
            at(0, 0.4, 0.4), at(0, 0.6, 0.4), at(0, 0.4, 0.6), at(0, 0.6, 0.4));

        assertEquals(0.0, parallelReversed, 1e-9);
        assertEquals(45.0, fortyFive, 1e-9);
    }

    @Test
    @DisplayName("population standard deviation; empty input → NaN")
    void statistics() {
        assertEquals(5.0, Kinematics.mean(List.of(2.0, 4.0, 9.0)), 1e-9);
        assertEquals(2.0, Kinematics.stdDev(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0)), 1e-9);
        assertTrue(Double.isNaN(Kinematics.stdDev(List.of())));
    }

    @Test
    @DisplayName("rounding and clamping")
    void roundAndClamp() {
        assertEquals(68.6, Kinematics.round(68.5714, 1), 1e-9);
        assertEquals(100.0, Kinematics.clamp(130.0, 0.0, 100.0));
        assertEquals(0.0, Kinematics.clamp(-4.0, 0.0, 100.0));
    }
}
