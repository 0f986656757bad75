package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.JointSample;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.buffer.MotionEvent;
import com.climbassessment.common.buffer.MotionEventKind;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.kinematics.Kinematics;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.climbassessment.common.kinematics.Kinematics.mean;

/**
 * Grip release: mean magnitude of the hand's second derivative of position in
 * the {@code releaseWindowSeconds} after each hold release (a hand MOVE event).
 * Releases whose window has fewer than three observed samples are skipped.
 */
public final class GripReleaseExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public GripReleaseExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.GRIP_RELEASE; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        Map<Joint, List<JointSample>> tracks = new EnumMap<>(Joint.class);
        List<Double> releaseJerks = new ArrayList<>();

        for (MotionEvent release : buffer.events(MotionEventKind.MOVE)) {
            if (!release.joint().isHand()) continue;
            List<JointSample> samples = tracks.computeIfAbsent(release.joint(),
                hand -> ExtractorSupport.handSamples(buffer, hand));
            double jerk = releaseJerk(samples, release.timestamp());
            if (!Double.isNaN(jerk)) {
                releaseJerks.add(jerk);
            }
        }

        if (releaseJerks.size() < config.minReleases()) {
            throw new InsufficientDataException(category(),
                "only " + releaseJerks.size() + " measurable hold releases, need " + config.minReleases());
        }

        double jerk = mean(releaseJerks);
        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("jerk", ExtractorSupport.round(jerk, 2));
        placeholders.put("releases", (double) releaseJerks.size());
        return RawSignal.of(category(), jerk, placeholders);
    }

    /**
     * Mean acceleration magnitude over the release window. The first triple is
     * centred on the last sample before the release, where the hand leaves the hold.
     */
    private double releaseJerk(List<JointSample> samples, double releaseAt) {
        int start = Math.max(0, ExtractorSupport.indexAtOrAfter(samples, releaseAt) - 2);
        double end = releaseAt + config.releaseWindowSeconds();
        List<Double> accelerations = new ArrayList<>();
        for (int i = start; i + 2 < samples.size() && samples.get(i + 2).timestamp() <= end; i++) {
            JointSample a = samples.get(i);
            JointSample b = samples.get(i + 1);
            JointSample c = samples.get(i + 2);
            if (!a.isObserved() || !b.isObserved() || !c.isObserved()) continue;
            double acceleration = Kinematics.acceleration(a, b, c);
            if (!Double.isNaN(acceleration)) {
                accelerations.add(acceleration);
            }
        }
        return accelerations.isEmpty() ? Double.NaN : mean(accelerations);
    }
}
