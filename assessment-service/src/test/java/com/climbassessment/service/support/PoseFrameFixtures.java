package com.climbassessment.service.support;

import com.climbassessment.common.model.Landmark;
import com.climbassessment.common.model.PoseFrame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Small 30 fps landmark streams for service-level tests. */
public final class PoseFrameFixtures {

    private static final double FPS = 30.0;

    private static final Map<String, double[]> NEUTRAL = neutral();

    private PoseFrameFixtures() {}

    /** A climber standing still for {@code seconds}, then reaching up with the right hand for 0.3 s. */
    public static List<PoseFrame> reachAfterStanding(double seconds) {
        List<PoseFrame> frames = new ArrayList<>();
        int still = (int) Math.round(seconds * FPS);
        for (int i = 0; i < still; i++) {
            frames.add(frame(i, 0.0));
        }
        int reach = (int) Math.round(0.3 * FPS);
        for (int i = 1; i <= reach; i++) {
            frames.add(frame(still + i - 1, -0.12 * i / reach));
        }
        return frames;
    }

    private static PoseFrame frame(long index, double rightWristDy) {
        Map<String, Landmark> landmarks = new LinkedHashMap<>();
        NEUTRAL.forEach((name, xy) -> {
            double y = name.equals("right_wrist") ? xy[1] + rightWristDy : xy[1];
            landmarks.put(name, Landmark.of(xy[0], y, 0.95));
        });
        return PoseFrame.of(index, index / FPS, landmarks);
    }

    private static Map<String, double[]> neutral() {
        Map<String, double[]> pose = new LinkedHashMap<>();
        pose.put("left_shoulder", new double[] {0.45, 0.40});
        pose.put("right_shoulder", new double[] {0.55, 0.40});
        pose.put("left_elbow", new double[] {0.35, 0.38});
        pose.put("right_elbow", new double[] {0.65, 0.38});
        pose.put("left_wrist", new double[] {0.33, 0.25});
        pose.put("right_wrist", new double[] {0.67, 0.25});
        pose.put("left_hip", new double[] {0.46, 0.60});
        pose.put("right_hip", new double[] {0.54, 0.60});
        pose.put("left_knee", new double[] {0.44, 0.75});
        pose.put("right_knee", new double[] {0.56, 0.75});
        pose.put("left_ankle", new double[] {0.44, 0.90});
        pose.put("right_ankle", new double[] {0.56, 0.90});
        pose.put("left_heel", new double[] {0.43, 0.92});
        pose.put("right_heel", new double[] {0.57, 0.92});
        pose.put("left_foot_index", new double[] {0.42, 0.91});
        pose.put("right_foot_index", new double[] {0.58, 0.91});
        return pose;
    }
}
