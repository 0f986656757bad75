package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered extractor over a sealed buffer. A category whose
 * extractor reports {@link InsufficientDataException} is recorded as
 * insufficient and left out; other categories are unaffected. Any other
 * runtime failure of one extractor is logged and handled the same way.
 */
public final class FeatureExtractionStage {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractionStage.class);

    private final List<FeatureExtractor> extractors;

    public FeatureExtractionStage(List<FeatureExtractor> extractors) {
        List<FeatureExtractor> ordered = new ArrayList<>(extractors);
        ordered.sort(Comparator.comparing(FeatureExtractor::category));
        this.extractors = List.copyOf(ordered);
    }

    /** All nine extractors with the given thresholds. */
    public static FeatureExtractionStage standard(ExtractorConfig config) {
        return new FeatureExtractionStage(List.of(
            new QuietFeetExtractor(config),
            new HipPositionExtractor(config),
            new DiagonalCoordinationExtractor(config),
            new RouteReadingExtractor(config),
            new RhythmExtractor(config),
            new DynamicControlExtractor(config),
            new GripReleaseExtractor(config),
            new ExhaustionExtractor(config),
            new ArmLoadExtractor(config)
        ));
    }

    public ExtractionOutcome extractAll(LandmarkBuffer buffer, GradeBracket bracket) {
        log.info("[FeatureExtraction] Running {} extractors sessionId={} frames={}",
            extractors.size(), buffer.sessionId(), buffer.acceptedFrames());

        Map<MetricCategory, RawSignal> signals = new EnumMap<>(MetricCategory.class);
        List<MetricCategory> insufficient = new ArrayList<>();
        for (FeatureExtractor extractor : extractors) {
            try {
                RawSignal signal = extractor.extract(buffer, bracket);
                signals.put(extractor.category(), signal);
                log.debug("[FeatureExtraction] category={} value={} sessionId={}",
                    extractor.category().id(), signal.value(), buffer.sessionId());
            } catch (InsufficientDataException e) {
                insufficient.add(extractor.category());
                log.info("[FeatureExtraction] Insufficient data sessionId={} {}", buffer.sessionId(), e.getMessage());
            } catch (RuntimeException e) {
                insufficient.add(extractor.category());
                log.error("[FeatureExtraction] Extractor failed category={} sessionId={}",
                    extractor.category().id(), buffer.sessionId(), e);
            }
        }
        return new ExtractionOutcome(signals, insufficient);
    }
}
