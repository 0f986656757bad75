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
 * Arm load: share of body load carried by the arms, estimated per frame by
 * {@link com.climbassessment.common.kinematics.BodyGeometry#armLoadShare}.
 * Raw value: mean arm share in percent over the climbing frames.
 */
public final class ArmLoadExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public ArmLoadExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.ARM_LOAD; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<Double> armShares = new ArrayList<>();
        for (BodySample sample : ExtractorSupport.climbingSamples(buffer)) {
            if (!Double.isNaN(sample.armShare())) {
                armShares.add(sample.armShare());
            }
        }

        if (armShares.size() < config.minClimbingFrames()) {
            throw new InsufficientDataException(category(),
                "only " + armShares.size() + " climbing frames with all limbs visible, need " + config.minClimbingFrames());
        }

        double armLoad = mean(armShares);
        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("arm_load", ExtractorSupport.round(armLoad, 0));
        placeholders.put("leg_load", ExtractorSupport.round(100.0 - armLoad, 0));
        return RawSignal.of(category(), armLoad, placeholders);
    }
}
