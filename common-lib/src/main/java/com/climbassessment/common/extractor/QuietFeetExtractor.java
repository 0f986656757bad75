package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.buffer.MotionEvent;
import com.climbassessment.common.buffer.MotionEventKind;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Foot precision ("quiet feet").
 *
 * <p>Only settles that follow a move of the same foot are counted; the stance
 * the climber starts in is not a placed hold. Each counted settle either lands
 * on a new hold or re-settles on the hold the foot already occupied. A re-settle within {@code holdRadius} counts as a
 * reposition unless the centre of mass has risen by at least
 * {@code comAdvance} since the hold was first taken (the climber has moved
 * past it and is simply standing on it again).
 *
 * <p>Raw value: normalised deviation of average repositions per hold from the
 * grade bracket's norm, {@code (avg - norm) / norm}. Negative is better than the norm.
 */
public final class QuietFeetExtractor implements FeatureExtractor {

    private static final List<Joint> FEET = List.of(Joint.LEFT_ANKLE, Joint.RIGHT_ANKLE);

    private final ExtractorConfig config;

    public QuietFeetExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.QUIET_FEET; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<MotionEvent> events = buffer.events();

        int holds = 0;
        int repositions = 0;
        for (Joint foot : FEET) {
            boolean moved = false;
            MotionEvent currentHold = null;
            for (MotionEvent event : events) {
                if (event.joint() != foot) continue;
                if (event.kind() == MotionEventKind.MOVE) {
                    moved = true;
                } else if (event.kind() == MotionEventKind.SETTLE && moved) {
                    if (currentHold != null && isSameHold(currentHold, event)) {
                        repositions++;
                    } else {
                        currentHold = event;
                        holds++;
                    }
                }
            }
        }

        if (holds < config.minFootHolds()) {
            throw new InsufficientDataException(category(),
                "only " + holds + " foot holds detected, need " + config.minFootHolds());
        }

        double average = (double) repositions / holds;
        double norm = config.footNorm(bracket);
        double deviation = (average - norm) / norm;

        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("repositions", ExtractorSupport.round(average, 1));
        placeholders.put("norm", norm);
        placeholders.put("holds", (double) holds);
        placeholders.put("deviation", ExtractorSupport.round(deviation * 100.0, 0));
        return RawSignal.of(category(), deviation, placeholders);
    }

    private boolean isSameHold(MotionEvent hold, MotionEvent settle) {
        double distance = Math.hypot(settle.x() - hold.x(), settle.y() - hold.y());
        if (distance > config.holdRadius()) {
            return false;
        }
        // y grows downward: a rise is a decrease in comY
        boolean advanced = !Double.isNaN(hold.comY()) && !Double.isNaN(settle.comY())
            && hold.comY() - settle.comY() >= config.comAdvance();
        return !advanced;
    }
}
