package com.climbassessment.common.buffer;

import com.climbassessment.common.model.Joint;

/**
 * Entry of the buffer's session-long motion event log.
 *
 * @param joint     limb the event belongs to; {@code null} for {@code PAUSE} and {@code FIRST_MOVE}
 * @param timestamp event start (for {@code SETTLE}, when the limb's speed first dropped)
 * @param duration  pause length in seconds; 0 for other kinds
 * @param x         limb position at the event, {@code NaN} when not applicable
 * @param y         limb position at the event, {@code NaN} when not applicable
 * @param comY      centre-of-mass height when a {@code SETTLE} was detected, {@code NaN} if unknown
 */
public record MotionEvent(
    MotionEventKind kind,
    Joint joint,
    double timestamp,
    double duration,
    double x,
    double y,
    double comY
) {
    static MotionEvent limb(MotionEventKind kind, Joint joint, double timestamp, double x, double y) {
        return new MotionEvent(kind, joint, timestamp, 0.0, x, y, Double.NaN);
    }

    static MotionEvent settle(Joint joint, double timestamp, double x, double y, double comY) {
        return new MotionEvent(MotionEventKind.SETTLE, joint, timestamp, 0.0, x, y, comY);
    }

    static MotionEvent pause(double start, double duration) {
        return new MotionEvent(MotionEventKind.PAUSE, null, start, duration, Double.NaN, Double.NaN, Double.NaN);
    }

    static MotionEvent firstMove(double timestamp) {
        return new MotionEvent(MotionEventKind.FIRST_MOVE, null, timestamp, 0.0, Double.NaN, Double.NaN, Double.NaN);
    }

    public double end() {
        return timestamp + duration;
    }
}
