package com.climbassessment.common.buffer;

/**
 * One buffered position of one joint. {@code x}/{@code y} are {@code NaN} when
 * {@link SampleState#LOST}; {@code z} is {@code null} when the provider gave no depth.
 */
public record JointSample(
    long frameIndex,
    double timestamp,
    double x,
    double y,
    Double z,
    double confidence,
    SampleState state
) {
    static JointSample lost(long frameIndex, double timestamp) {
        return new JointSample(frameIndex, timestamp, Double.NaN, Double.NaN, null, 0.0, SampleState.LOST);
    }

    JointSample heldAt(long frameIndex, double timestamp) {
        return new JointSample(frameIndex, timestamp, x, y, z, confidence, SampleState.HELD);
    }

    /** Position is known (observed or held within the hold limit). */
    public boolean isUsable() {
        return state != SampleState.LOST;
    }

    public boolean isObserved() {
        return state == SampleState.OBSERVED;
    }

    public boolean hasDepth() {
        return z != null && isUsable();
    }
}
