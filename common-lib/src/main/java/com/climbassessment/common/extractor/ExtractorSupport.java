package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.BodySample;
import com.climbassessment.common.buffer.JointSample;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.buffer.MotionEvent;
import com.climbassessment.common.buffer.MotionEventKind;
import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.model.Joint;

import java.util.ArrayList;
import java.util.List;

/** Shared helpers for the extractors. */
final class ExtractorSupport {

    private ExtractorSupport() { /* utility class */ }

    /** Index of the first sample at or after {@code timestamp}; {@code samples.size()} if none. */
    static int indexAtOrAfter(List<JointSample> samples, double timestamp) {
        int low = 0;
        int high = samples.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (samples.get(mid).timestamp() < timestamp) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Body samples between the first move and the end of the session that do
     * not fall inside a pause. Empty when the climber never moved.
     */
    static List<BodySample> climbingSamples(LandmarkBuffer buffer) {
        List<MotionEvent> firstMove = buffer.events(MotionEventKind.FIRST_MOVE);
        if (firstMove.isEmpty()) {
            return List.of();
        }
        double start = firstMove.get(0).timestamp();
        List<MotionEvent> pauses = buffer.events(MotionEventKind.PAUSE);
        List<BodySample> samples = new ArrayList<>();
        for (BodySample sample : buffer.bodySamples()) {
            if (sample.timestamp() >= start && !insidePause(sample.timestamp(), pauses)) {
                samples.add(sample);
            }
        }
        return samples;
    }

    /** Every sample of {@code hand} in the session, oldest first. */
    static List<JointSample> handSamples(LandmarkBuffer buffer, Joint hand) {
        List<JointSample> samples = new ArrayList<>(buffer.bodySamples().size());
        for (BodySample sample : buffer.bodySamples()) {
            samples.add(sample.hand(hand));
        }
        return samples;
    }

    private static boolean insidePause(double timestamp, List<MotionEvent> pauses) {
        for (MotionEvent pause : pauses) {
            if (timestamp >= pause.timestamp() && timestamp <= pause.end()) {
                return true;
            }
        }
        return false;
    }

    static double round(double value, int decimals) {
        return Kinematics.round(value, decimals);
    }
}
