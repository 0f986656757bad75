package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.buffer.MotionEvent;
import com.climbassessment.common.buffer.MotionEventKind;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Route reading: time spent looking before the first move plus a credit per
 * mid-climb pause. Raw value: planning seconds.
 */
public final class RouteReadingExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public RouteReadingExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.ROUTE_READING; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<MotionEvent> firstMove = buffer.events(MotionEventKind.FIRST_MOVE);
        if (firstMove.isEmpty()) {
            throw new InsufficientDataException(category(), "no limb movement detected in session");
        }

        double preview = firstMove.get(0).timestamp() - buffer.firstTimestamp();
        int pauses = buffer.events(MotionEventKind.PAUSE).size();
        double planning = preview + config.pauseCreditSeconds() * pauses;

        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("preview", ExtractorSupport.round(preview, 1));
        placeholders.put("pauses", (double) pauses);
        placeholders.put("planning", ExtractorSupport.round(planning, 1));
        return RawSignal.of(category(), planning, placeholders);
    }
}
