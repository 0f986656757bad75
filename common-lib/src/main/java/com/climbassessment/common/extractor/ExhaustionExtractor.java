package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.BodySample;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.kinematics.PlanarPoint;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exhaustion: how much movement quality drops from the first to the last
 * quarter of the climb. Only climbing frames count, so route reading before
 * the first move and mid-climb pauses do not dilute either quarter.
 *
 * <p>Quality is read from centre-of-mass jitter, the mean magnitude of the
 * frame-to-frame second difference of the centre of mass. Raw value:
 * degradation in percent, {@code (lastJitter - firstJitter) / firstJitter * 100},
 * clamped to [0, 100].
 */
public final class ExhaustionExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public ExhaustionExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.EXHAUSTION; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<PlanarPoint> path = new ArrayList<>();
        for (BodySample sample : ExtractorSupport.climbingSamples(buffer)) {
            PlanarPoint com = sample.centerOfMass();
            if (com != null) {
                path.add(com);
            }
        }

        if (path.size() < config.minExhaustionFrames()) {
            throw new InsufficientDataException(category(),
                "only " + path.size() + " climbing frames with a centre of mass, need " + config.minExhaustionFrames());
        }

        int quarter = path.size() / 4;
        double first = jitter(path.subList(0, quarter));
        double last = jitter(path.subList(path.size() - quarter, path.size()));

        double degradation;
        if (first == 0.0) {
            degradation = last == 0.0 ? 0.0 : 100.0;
        } else {
            degradation = Math.max(0.0, Math.min(100.0, (last - first) / first * 100.0));
        }

        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("percent", ExtractorSupport.round(degradation, 0));
        return RawSignal.of(category(), degradation, placeholders);
    }

    private static double jitter(List<PlanarPoint> points) {
        if (points.size() < 3) return 0.0;
        double sum = 0;
        for (int i = 2; i < points.size(); i++) {
            PlanarPoint a = points.get(i - 2);
            PlanarPoint b = points.get(i - 1);
            PlanarPoint c = points.get(i);
            sum += Math.hypot(c.x() - 2 * b.x() + a.x(), c.y() - 2 * b.y() + a.y());
        }
        return sum / (points.size() - 2);
    }
}
