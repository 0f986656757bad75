package com.climbassessment.common.tension;

import com.climbassessment.common.buffer.FrameSnapshot;
import com.climbassessment.common.buffer.JointSample;
import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.model.BodyRegion;
import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.Side;
import com.climbassessment.common.model.TensionEvent;
import com.climbassessment.common.model.TensionKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-long joint tension tracking, independent of the technique categories.
 *
 * <h3>Watched conditions</h3>
 * <ul>
 *   <li><strong>Elbow angle lock</strong>: shoulder–elbow–wrist angle below
 *       {@code elbowLockBelow}; extremum is the smallest angle.</li>
 *   <li><strong>Shoulder angle lock</strong>: hip–shoulder–elbow angle above
 *       {@code shoulderLockAbove}; extremum is the largest angle.</li>
 *   <li><strong>Knee rotation</strong>: hip/knee lateral offset above
 *       {@code kneeLateralAbove}, or hip–knee–ankle angle inside
 *       [{@code kneeAngleMin}, {@code kneeAngleMax}]; extremum is the largest
 *       lateral offset in percent of frame width.</li>
 *   <li><strong>Lower-back twist</strong>: angle between shoulder line and
 *       hip line above {@code twistAbove}; no side.</li>
 * </ul>
 *
 * <p>Each side keeps its own counter, so a crossing on the left arm never
 * counts towards the right. Fed one snapshot per accepted frame; one instance
 * per session.
 */
public final class TensionAnalyzer {

    private final TensionThresholds thresholds;
    private final Map<Key, TensionCounter> counters = new LinkedHashMap<>();

    public TensionAnalyzer(TensionThresholds thresholds) {
        this.thresholds = thresholds;
        for (Side side : List.of(Side.LEFT, Side.RIGHT)) {
            counters.put(new Key(BodyRegion.SHOULDER, TensionKind.ANGLE_LOCK, side), new TensionCounter(false));
        }
        for (Side side : List.of(Side.LEFT, Side.RIGHT)) {
            counters.put(new Key(BodyRegion.ELBOW, TensionKind.ANGLE_LOCK, side), new TensionCounter(true));
        }
        for (Side side : List.of(Side.LEFT, Side.RIGHT)) {
            counters.put(new Key(BodyRegion.KNEE, TensionKind.ROTATION, side), new TensionCounter(false));
        }
        counters.put(new Key(BodyRegion.LOWER_BACK, TensionKind.TWIST, Side.NONE), new TensionCounter(false));
    }

    public void observe(FrameSnapshot frame) {
        for (Side side : List.of(Side.LEFT, Side.RIGHT)) {
            observeElbow(frame, side);
            observeShoulder(frame, side);
            observeKnee(frame, side);
        }
        observeTwist(frame);
    }

    // ── Regions ────────────────────────────────────────────────────

    private void observeElbow(FrameSnapshot frame, Side side) {
        double angle = angle(frame, Joint.shoulder(side), Joint.elbow(side), Joint.wrist(side));
        if (Double.isNaN(angle)) return;
        counter(BodyRegion.ELBOW, TensionKind.ANGLE_LOCK, side)
            .update(angle < thresholds.elbowLockBelow(), angle);
    }

    private void observeShoulder(FrameSnapshot frame, Side side) {
        double angle = angle(frame, Joint.hip(side), Joint.shoulder(side), Joint.elbow(side));
        if (Double.isNaN(angle)) return;
        counter(BodyRegion.SHOULDER, TensionKind.ANGLE_LOCK, side)
            .update(angle > thresholds.shoulderLockAbove(), angle);
    }

    private void observeKnee(FrameSnapshot frame, Side side) {
        Joint hip = Joint.hip(side);
        Joint knee = Joint.knee(side);
        if (!frame.usable(hip, knee)) return;
        double lateral = Math.abs(frame.get(knee).x() - frame.get(hip).x());
        double angle = angle(frame, hip, knee, Joint.ankle(side));
        boolean risky = lateral > thresholds.kneeLateralAbove()
            || (!Double.isNaN(angle) && angle >= thresholds.kneeAngleMin() && angle <= thresholds.kneeAngleMax());
        counter(BodyRegion.KNEE, TensionKind.ROTATION, side).update(risky, lateral * 100.0);
    }

    private void observeTwist(FrameSnapshot frame) {
        if (!frame.usable(Joint.LEFT_SHOULDER, Joint.RIGHT_SHOULDER, Joint.LEFT_HIP, Joint.RIGHT_HIP)) return;
        double twist = Kinematics.lineAngle(
            frame.get(Joint.LEFT_SHOULDER), frame.get(Joint.RIGHT_SHOULDER),
            frame.get(Joint.LEFT_HIP), frame.get(Joint.RIGHT_HIP));
        if (Double.isNaN(twist)) return;
        counter(BodyRegion.LOWER_BACK, TensionKind.TWIST, Side.NONE).update(twist > thresholds.twistAbove(), twist);
    }

    private static double angle(FrameSnapshot frame, Joint a, Joint vertex, Joint c) {
        if (!frame.usable(a, vertex, c)) return Double.NaN;
        JointSample first = frame.get(a);
        JointSample middle = frame.get(vertex);
        JointSample last = frame.get(c);
        return Kinematics.angleAt(first, middle, last);
    }

    private TensionCounter counter(BodyRegion region, TensionKind kind, Side side) {
        return counters.get(new Key(region, kind, side));
    }

    // ── Results ────────────────────────────────────────────────────

    /** Regions/sides with at least one crossing, in fixed region/side order. */
    public List<TensionEvent> events() {
        List<TensionEvent> events = new ArrayList<>();
        counters.forEach((key, counter) -> {
            if (counter.count() > 0) {
                events.add(new TensionEvent(key.region(), key.kind(), key.side(),
                    counter.count(), Kinematics.round(counter.extremum(), 1)));
            }
        });
        return List.copyOf(events);
    }

    private record Key(BodyRegion region, TensionKind kind, Side side) {}
}
