package com.climbassessment.common.fixture;

import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.Landmark;
import com.climbassessment.common.model.PoseFrame;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds synthetic 30 fps landmark streams for tests.
 *
 * <p>The climber starts in a neutral stance facing the wall. Holds emit
 * identical frames; moves interpolate the given joints linearly so their speed
 * is exactly {@code distance / seconds}. Timestamps are {@code frameIndex / 30}.
 */
public final class ClimbFrames {

    public static final double FPS = 30.0;

    private static final double VISIBLE = 0.95;
    private static final double OCCLUDED = 0.1;

    private final Map<Joint, double[]> pose = new EnumMap<>(Joint.class);
    private final Set<Joint> hidden = EnumSet.noneOf(Joint.class);
    private final List<PoseFrame> frames = new ArrayList<>();
    private long frameIndex;

    private ClimbFrames() {
        place(Joint.LEFT_SHOULDER, 0.45, 0.40);
        place(Joint.RIGHT_SHOULDER, 0.55, 0.40);
        place(Joint.LEFT_ELBOW, 0.35, 0.38);
        place(Joint.RIGHT_ELBOW, 0.65, 0.38);
        place(Joint.LEFT_WRIST, 0.33, 0.25);
        place(Joint.RIGHT_WRIST, 0.67, 0.25);
        place(Joint.LEFT_HIP, 0.46, 0.60);
        place(Joint.RIGHT_HIP, 0.54, 0.60);
        place(Joint.LEFT_KNEE, 0.44, 0.75);
        place(Joint.RIGHT_KNEE, 0.56, 0.75);
        place(Joint.LEFT_ANKLE, 0.44, 0.90);
        place(Joint.RIGHT_ANKLE, 0.56, 0.90);
        place(Joint.LEFT_HEEL, 0.43, 0.92);
        place(Joint.RIGHT_HEEL, 0.57, 0.92);
        place(Joint.LEFT_FOOT_INDEX, 0.42, 0.91);
        place(Joint.RIGHT_FOOT_INDEX, 0.58, 0.91);
    }

    public static ClimbFrames start() {
        return new ClimbFrames();
    }

    /**
     * Three seconds of route reading, {@code cycles} pairs of diagonal moves
     * (right hand with left foot, then left hand with right foot, 0.4 units/s,
     * 0.5 s apart) and a final dynamic right-hand move followed by a second of rest.
     */
    public static List<PoseFrame> steadyClimb(int cycles) {
        ClimbFrames climb = start().hold(3.0);
        for (int i = 0; i < cycles; i++) {
            double dy = i % 2 == 0 ? -0.12 : 0.12;
            climb.move(0.3, Joint.RIGHT_WRIST, 0, dy, Joint.LEFT_ANKLE, 0, dy).hold(0.5)
                 .move(0.3, Joint.LEFT_WRIST, 0, dy, Joint.RIGHT_ANKLE, 0, dy).hold(0.5);
        }
        return climb.move(0.1, Joint.RIGHT_WRIST, 0, -0.2).hold(1.0).frames();
    }

    // ── Pose edits (no frames emitted) ─────────────────────────────

    public ClimbFrames shift(Joint joint, double dx, double dy) {
        double[] position = pose.get(joint);
        position[0] += dx;
        position[1] += dy;
        return this;
    }

    /** Subsequent frames report these joints below the confidence floor. */
    public ClimbFrames hide(Joint... joints) {
        hidden.addAll(List.of(joints));
        return this;
    }

    public ClimbFrames show(Joint... joints) {
        List.of(joints).forEach(hidden::remove);
        return this;
    }

    // ── Frame emission ─────────────────────────────────────────────

    public ClimbFrames hold(double seconds) {
        int count = (int) Math.round(seconds * FPS);
        for (int i = 0; i < count; i++) {
            emit();
        }
        return this;
    }

    public ClimbFrames move(double seconds, Joint joint, double dx, double dy) {
        return moveAll(seconds, Map.of(joint, new double[] {dx, dy}));
    }

    public ClimbFrames move(double seconds, Joint first, double firstDx, double firstDy,
                            Joint second, double secondDx, double secondDy) {
        Map<Joint, double[]> deltas = new EnumMap<>(Joint.class);
        deltas.put(first, new double[] {firstDx, firstDy});
        deltas.put(second, new double[] {secondDx, secondDy});
        return moveAll(seconds, deltas);
    }

    public ClimbFrames moveAll(double seconds, Map<Joint, double[]> deltas) {
        int count = Math.max(1, (int) Math.round(seconds * FPS));
        Map<Joint, double[]> origin = new EnumMap<>(Joint.class);
        deltas.keySet().forEach(joint -> origin.put(joint, pose.get(joint).clone()));
        for (int step = 1; step <= count; step++) {
            double fraction = (double) step / count;
            for (Map.Entry<Joint, double[]> delta : deltas.entrySet()) {
                double[] from = origin.get(delta.getKey());
                double[] position = pose.get(delta.getKey());
                position[0] = from[0] + delta.getValue()[0] * fraction;
                position[1] = from[1] + delta.getValue()[1] * fraction;
            }
            emit();
        }
        return this;
    }

    public List<PoseFrame> frames() {
        return List.copyOf(frames);
    }

    /** Timestamp of the frame that will be emitted next. */
    public double now() {
        return frameIndex / FPS;
    }

    private void emit() {
        Map<String, Landmark> landmarks = new HashMap<>();
        pose.forEach((joint, position) -> landmarks.put(joint.wireName(),
            Landmark.of(position[0], position[1], hidden.contains(joint) ? OCCLUDED : VISIBLE)));
        frames.add(PoseFrame.of(frameIndex, frameIndex / FPS, landmarks));
        frameIndex++;
    }

    private void place(Joint joint, double x, double y) {
        pose.put(joint, new double[] {x, y});
    }
}
