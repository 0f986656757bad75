package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * One sampled video frame as delivered by the pose provider.
 *
 * @param frameIndex monotonically increasing frame number
 * @param timestamp  seconds since the start of the recording
 * @param landmarks  landmark observations keyed by wire name ({@code left_wrist}, ...)
 */
public record PoseFrame(
    @JsonProperty("frameIndex") long frameIndex,
    @JsonProperty("timestamp") double timestamp,
    @JsonProperty("landmarks") Map<String, Landmark> landmarks
) {
    public PoseFrame {
        Map<String, Landmark> present = new HashMap<>();
        if (landmarks != null) {
            landmarks.forEach((name, landmark) -> {
                if (name != null && landmark != null) {
                    present.put(name, landmark);
                }
            });
        }
        landmarks = Map.copyOf(present);
    }

    public static PoseFrame of(long frameIndex, double timestamp, Map<String, Landmark> landmarks) {
        return new PoseFrame(frameIndex, timestamp, landmarks);
    }

    /** Landmark for {@code joint}, or {@code null} when the provider did not emit it. */
    public Landmark landmark(Joint joint) {
        return landmarks.get(joint.wireName());
    }
}
