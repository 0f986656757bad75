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
import static com.climbassessment.common.kinematics.Kinematics.stdDev;

/**
 * Rhythm: standard deviation of the intervals between consecutive hand moves,
 * in milliseconds. Intervals longer than {@code restCutoffSeconds} are rests
 * and do not count.
 */
public final class RhythmExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public RhythmExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.RHYTHM; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<Double> handMoves = new ArrayList<>();
        for (MotionEvent move : buffer.events(MotionEventKind.MOVE)) {
            if (move.joint().isHand()) {
                handMoves.add(move.timestamp());
            }
        }
        handMoves.sort(Double::compare);

        List<Double> intervals = new ArrayList<>();
        for (int i = 1; i < handMoves.size(); i++) {
            double interval = handMoves.get(i) - handMoves.get(i - 1);
            if (interval > 0 && interval <= config.restCutoffSeconds()) {
                intervals.add(interval * 1000.0);
            }
        }

        if (intervals.size() < config.minRhythmIntervals()) {
            throw new InsufficientDataException(category(),
                "only " + intervals.size() + " inter-move intervals, need " + config.minRhythmIntervals());
        }

        double variance = stdDev(intervals);
        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("variance", ExtractorSupport.round(variance, 0));
        placeholders.put("interval", ExtractorSupport.round(mean(intervals) / 1000.0, 1));
        placeholders.put("moves", (double) handMoves.size());
        return RawSignal.of(category(), variance, placeholders);
    }
}
