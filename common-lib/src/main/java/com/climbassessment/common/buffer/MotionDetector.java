package com.climbassessment.common.buffer;

import com.climbassessment.common.kinematics.BodyGeometry;
import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.kinematics.PlanarPoint;
import com.climbassessment.common.model.Joint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-limb move/settle state machine plus whole-body pause tracking. Fed one
 * pair of consecutive frame snapshots per accepted frame; appends to the
 * motion event log and never removes from it.
 *
 * <p>A limb's speed is only measured between two <em>observed</em> samples;
 * any interval touching a held or lost sample resets the limb's dwell timer
 * and does not count towards whole-body stillness.
 */
final class MotionDetector {

    static final List<Joint> LIMBS = List.of(
        Joint.LEFT_WRIST, Joint.RIGHT_WRIST, Joint.LEFT_ANKLE, Joint.RIGHT_ANKLE);

    /** Minimum limbs with a measured speed before the body can be called still. */
    private static final int MIN_LIMBS_FOR_STILLNESS = 2;

    private final BufferConfig config;
    private final List<MotionEvent> events = new ArrayList<>();
    private final Map<Joint, LimbState> limbs = new EnumMap<>(Joint.class);

    private double firstMoveAt = Double.NaN;
    private double stillSince = Double.NaN;

    MotionDetector(BufferConfig config) {
        this.config = config;
        for (Joint limb : LIMBS) {
            limbs.put(limb, new LimbState());
        }
    }

    void observe(FrameSnapshot previous, FrameSnapshot current) {
        int measured = 0;
        boolean active = false;

        for (Joint limb : LIMBS) {
            JointSample before = previous.get(limb);
            JointSample now = current.get(limb);
            LimbState state = limbs.get(limb);

            if (!before.isObserved() || !now.isObserved()) {
                state.lowSince = Double.NaN;
                continue;
            }
            double speed = Kinematics.speed(before, now);
            if (Double.isNaN(speed)) {
                state.lowSince = Double.NaN;
                continue;
            }
            measured++;
            if (speed >= config.settleVelocity()) {
                active = true;
            }
            trackLimb(limb, state, speed, before, now, current);
        }

        // ── Whole-body pause ───────────────────────────────────────
        if (measured >= MIN_LIMBS_FOR_STILLNESS && !active) {
            if (Double.isNaN(stillSince)) {
                stillSince = previous.timestamp();
            }
        } else if (active) {
            closeStillPeriod(previous.timestamp());
        }
    }

    private void trackLimb(Joint limb, LimbState state, double speed,
                           JointSample before, JointSample now, FrameSnapshot current) {
        if (speed > config.moveVelocity()) {
            if (!state.moving) {
                if (Double.isNaN(firstMoveAt)) {
                    firstMoveAt = now.timestamp();
                    events.add(MotionEvent.firstMove(firstMoveAt));
                }
                events.add(MotionEvent.limb(MotionEventKind.MOVE, limb, now.timestamp(), before.x(), before.y()));
                state.moving = true;
                state.settled = false;
            }
            state.lowSince = Double.NaN;
        } else if (speed < config.settleVelocity()) {
            if (Double.isNaN(state.lowSince)) {
                state.lowSince = before.timestamp();
            }
            if (!state.settled && now.timestamp() - state.lowSince >= config.settleDwellSeconds()) {
                double comY = BodyGeometry.centerOfMass(current).map(PlanarPoint::y).orElse(Double.NaN);
                events.add(MotionEvent.settle(limb, state.lowSince, now.x(), now.y(), comY));
                state.settled = true;
                state.moving = false;
            }
        } else {
            state.lowSince = Double.NaN;
        }

        if (limb.isHand() && speed > config.dynamicVelocity()
                && now.timestamp() - state.lastDynamic >= config.dynamicRefractorySeconds()) {
            events.add(MotionEvent.limb(MotionEventKind.DYNAMIC, limb, now.timestamp(), now.x(), now.y()));
            state.lastDynamic = now.timestamp();
        }
    }

    private void closeStillPeriod(double end) {
        if (!Double.isNaN(stillSince) && !Double.isNaN(firstMoveAt) && stillSince >= firstMoveAt) {
            double duration = end - stillSince;
            if (duration >= config.pauseMinSeconds()) {
                events.add(MotionEvent.pause(stillSince, duration));
            }
        }
        stillSince = Double.NaN;
    }

    /** Drops an open still period: stillness at the end of the stream is not a mid-climb pause. */
    void seal() {
        stillSince = Double.NaN;
    }

    List<MotionEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    private static final class LimbState {
        boolean moving;
        boolean settled;
        double lowSince = Double.NaN;
        double lastDynamic = Double.NEGATIVE_INFINITY;
    }
}
