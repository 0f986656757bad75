package com.climbassessment.common.buffer;

import com.climbassessment.common.model.Joint;

import java.util.Collections;
import java.util.Map;

/**
 * All joint samples of one buffered frame. Tracks are index-aligned, so a
 * snapshot is assembled by reading the same position from every track.
 */
public record FrameSnapshot(
    int position,
    long frameIndex,
    double timestamp,
    Map<Joint, JointSample> samples
) {
    public FrameSnapshot {
        samples = Collections.unmodifiableMap(samples);
    }

    public JointSample get(Joint joint) {
        return samples.get(joint);
    }

    public boolean usable(Joint... joints) {
        for (Joint joint : joints) {
            JointSample sample = samples.get(joint);
            if (sample == null || !sample.isUsable()) {
                return false;
            }
        }
        return true;
    }
}
