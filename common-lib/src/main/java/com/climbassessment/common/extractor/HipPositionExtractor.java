package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.BodySample;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.climbassessment.common.kinematics.Kinematics.mean;

/**
 * Hip position: mean angle between the hip-centre→shoulder-centre vector and
 * the wall-plane vertical over climbing frames.
 *
 * <p>The wall is taken to face the camera, so its normal is the depth axis.
 * With depth available the angle captures both sideways lean and hips hanging
 * away from the wall; without depth only the in-plane lean is measured.
 */
public final class HipPositionExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public HipPositionExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.HIP_POSITION; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<Double> angles = new ArrayList<>();
        for (BodySample sample : ExtractorSupport.climbingSamples(buffer)) {
            if (!Double.isNaN(sample.trunkAngle())) {
                angles.add(sample.trunkAngle());
            }
        }

        if (angles.size() < config.minClimbingFrames()) {
            throw new InsufficientDataException(category(),
                "only " + angles.size() + " climbing frames with a visible trunk, need " + config.minClimbingFrames());
        }

        double angle = mean(angles);
        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("angle", ExtractorSupport.round(angle, 1));
        placeholders.put("overload", ExtractorSupport.round(Math.max(0.0, angle - 5.0) * 2.0, 0));
        return RawSignal.of(category(), angle, placeholders);
    }
}
