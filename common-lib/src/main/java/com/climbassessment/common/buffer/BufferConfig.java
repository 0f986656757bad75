package com.climbassessment.common.buffer;

import com.climbassessment.common.model.Joint;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable landmark-buffer and motion-detection thresholds.
 *
 * <p>Velocities are in normalised image units per second; durations in seconds.
 *
 * @param capacity             samples retained per joint (ring size)
 * @param defaultMinConfidence confidence floor for joints without an override
 * @param minConfidence        per-joint confidence floors
 * @param maxHoldSeconds       longest span a missing joint is held at its last position
 * @param moveVelocity         limb speed above which the limb is moving
 * @param settleVelocity       limb speed below which the limb is at rest
 * @param settleDwellSeconds   time below {@code settleVelocity} before a limb counts as settled
 * @param dynamicVelocity      hand speed that marks a dynamic move
 * @param dynamicRefractorySeconds minimum gap between two dynamic moves of the same hand
 * @param pauseMinSeconds      minimum whole-body stillness that counts as a pause
 */
public record BufferConfig(
    int capacity,
    double defaultMinConfidence,
    Map<Joint, Double> minConfidence,
    double maxHoldSeconds,
    double moveVelocity,
    double settleVelocity,
    double settleDwellSeconds,
    double dynamicVelocity,
    double dynamicRefractorySeconds,
    double pauseMinSeconds
) {
    public BufferConfig {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be at least 2, was " + capacity);
        }
        if (settleVelocity >= moveVelocity) {
            throw new IllegalArgumentException("settleVelocity must be below moveVelocity");
        }
        minConfidence = minConfidence == null || minConfidence.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(minConfidence));
    }

    public static BufferConfig defaults() {
        return new BufferConfig(3600, 0.5, Map.of(), 0.5,
            0.30, 0.12, 0.25, 1.2, 0.5, 1.0);
    }

    public BufferConfig withCapacity(int newCapacity) {
        return new BufferConfig(newCapacity, defaultMinConfidence, minConfidence, maxHoldSeconds,
            moveVelocity, settleVelocity, settleDwellSeconds, dynamicVelocity,
            dynamicRefractorySeconds, pauseMinSeconds);
    }

    public BufferConfig withMaxHoldSeconds(double seconds) {
        return new BufferConfig(capacity, defaultMinConfidence, minConfidence, seconds,
            moveVelocity, settleVelocity, settleDwellSeconds, dynamicVelocity,
            dynamicRefractorySeconds, pauseMinSeconds);
    }

    public BufferConfig withDefaultMinConfidence(double confidence) {
        return new BufferConfig(capacity, confidence, minConfidence, maxHoldSeconds,
            moveVelocity, settleVelocity, settleDwellSeconds, dynamicVelocity,
            dynamicRefractorySeconds, pauseMinSeconds);
    }

    public double minConfidence(Joint joint) {
        return minConfidence.getOrDefault(joint, defaultMinConfidence);
    }
}
