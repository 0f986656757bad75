package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.buffer.MotionEvent;
import com.climbassessment.common.buffer.MotionEventKind;
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
 * Dynamic control: for every dynamic hand move, time until that hand next
 * settles. A hand that does not settle within {@code settleTimeoutSeconds} is
 * charged the timeout. Raw value: mean settle time in seconds.
 */
public final class DynamicControlExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public DynamicControlExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.DYNAMIC_CONTROL; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<MotionEvent> dynamics = buffer.events(MotionEventKind.DYNAMIC);
        if (dynamics.isEmpty()) {
            throw new InsufficientDataException(category(), "no dynamic moves detected");
        }
        List<MotionEvent> settles = buffer.events(MotionEventKind.SETTLE);

        List<Double> settleTimes = new ArrayList<>();
        for (MotionEvent dynamic : dynamics) {
            double settleTime = config.settleTimeoutSeconds();
            for (MotionEvent settle : settles) {
                if (settle.joint() == dynamic.joint() && settle.timestamp() >= dynamic.timestamp()) {
                    settleTime = Math.min(settleTime, settle.timestamp() - dynamic.timestamp());
                    break;
                }
            }
            settleTimes.add(settleTime);
        }

        double time = mean(settleTimes);
        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("time", ExtractorSupport.round(time, 2));
        placeholders.put("moves", (double) dynamics.size());
        return RawSignal.of(category(), time, placeholders);
    }
}
