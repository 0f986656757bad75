package com.climbassessment.common.descent;

import com.climbassessment.common.buffer.FrameSnapshot;
import com.climbassessment.common.buffer.JointSample;
import com.climbassessment.common.kinematics.BodyGeometry;
import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.kinematics.PlanarPoint;
import com.climbassessment.common.model.DescentEvent;
import com.climbassessment.common.model.DescentKind;
import com.climbassessment.common.model.Joint;

import java.util.ArrayList;
import java.util.List;

/**
 * Session-long fall detection from the centre-of-mass trajectory.
 *
 * <p>A descent episode is a run of consecutive frames in which the centre of
 * mass moves down faster than {@code descentVelocity}. Episodes dropping less
 * than {@code minDrop} are ignored. A reported episode is a
 * {@link DescentKind#FALL} when its downward speed is uneven (peak over mean
 * at least {@code controlledRatio}, a slip out of a slow descent) or when a
 * hand shoots upward relative to the body (grabbing for a hold); otherwise it
 * is {@link DescentKind#CONTROLLED}.
 *
 * <p>Fed one snapshot per accepted frame; one instance per session. A frame
 * without a centre of mass ends the current episode.
 */
public final class DescentAnalyzer {

    private static final Joint[] HANDS = {Joint.LEFT_WRIST, Joint.RIGHT_WRIST};

    private final DescentThresholds thresholds;
    private final List<DescentEvent> events = new ArrayList<>();

    private FrameSnapshot previous;
    private PlanarPoint previousCom;
    private Episode episode;

    public DescentAnalyzer(DescentThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public void observe(FrameSnapshot frame) {
        PlanarPoint com = BodyGeometry.centerOfMass(frame).orElse(null);
        if (com == null) {
            closeEpisode();
            previous = null;
            previousCom = null;
            return;
        }

        if (previous != null) {
            double dt = frame.timestamp() - previous.timestamp();
            // y grows downward
            double downward = (com.y() - previousCom.y()) / dt;
            if (downward > thresholds.descentVelocity()) {
                if (episode == null) {
                    episode = new Episode(previous.timestamp(), previousCom.y());
                }
                episode.add(frame.timestamp(), com.y(), downward, grabbing(previous, frame, downward, dt));
            } else {
                closeEpisode();
            }
        }
        previous = frame;
        previousCom = com;
    }

    /** Ends the stream. A descent still in progress is reported: falls often end the recording. */
    public void seal() {
        closeEpisode();
    }

    /** Reported descents in time order. */
    public List<DescentEvent> events() {
        return List.copyOf(events);
    }

    private boolean grabbing(FrameSnapshot before, FrameSnapshot now, double comDownward, double dt) {
        for (Joint hand : HANDS) {
            JointSample from = before.get(hand);
            JointSample to = now.get(hand);
            if (from == null || to == null || !from.isObserved() || !to.isObserved()) continue;
            double handDownward = (to.y() - from.y()) / dt;
            if (comDownward - handDownward > thresholds.grabVelocity()) {
                return true;
            }
        }
        return false;
    }

    private void closeEpisode() {
        if (episode == null) {
            return;
        }
        Episode closed = episode;
        episode = null;

        double drop = closed.lastY - closed.startY;
        if (drop < thresholds.minDrop()) {
            return;
        }
        double mean = Kinematics.mean(closed.speeds);
        double peak = closed.speeds.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double ratio = mean > 0 ? peak / mean : 1.0;
        DescentKind kind = closed.handGrab || ratio >= thresholds.controlledRatio()
            ? DescentKind.FALL
            : DescentKind.CONTROLLED;

        events.add(new DescentEvent(kind,
            Kinematics.round(closed.start, 2),
            Kinematics.round(closed.end - closed.start, 2),
            Kinematics.round(drop, 3),
            Kinematics.round(peak, 2),
            Kinematics.round(ratio, 2),
            closed.handGrab));
    }

    private static final class Episode {
        final double start;
        final double startY;
        final List<Double> speeds = new ArrayList<>();
        double end;
        double lastY;
        boolean handGrab;

        Episode(double start, double startY) {
            this.start = start;
            this.startY = startY;
        }

        void add(double timestamp, double y, double speed, boolean grab) {
            end = timestamp;
            lastY = y;
            speeds.add(speed);
            handGrab |= grab;
        }
    }
}
