package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.BodySample;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.buffer.MotionEvent;
import com.climbassessment.common.buffer.MotionEventKind;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.kinematics.PlanarPoint;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.climbassessment.common.kinematics.Kinematics.stdDev;

/**
 * Diagonal coordination: every hand move is paired with the nearest foot move
 * within {@code pairWindowSeconds}; a pair is diagonal when hand and foot are
 * on opposite sides. Lateral centre-of-mass sway over climbing frames is
 * reported alongside so the score can penalise it.
 *
 * <p>Raw value: fraction of diagonal pairs in [0, 1].
 */
public final class DiagonalCoordinationExtractor implements FeatureExtractor {

    private final ExtractorConfig config;

    public DiagonalCoordinationExtractor(ExtractorConfig config) {
        this.config = config;
    }

    @Override
    public MetricCategory category() { return MetricCategory.DIAGONAL; }

    @Override
    public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
        List<MotionEvent> moves = buffer.events(MotionEventKind.MOVE);
        List<MotionEvent> hands = new ArrayList<>();
        List<MotionEvent> feet = new ArrayList<>();
        for (MotionEvent move : moves) {
            if (move.joint().isHand()) hands.add(move);
            else if (move.joint().isFoot()) feet.add(move);
        }

        int pairs = 0;
        int diagonal = 0;
        for (MotionEvent hand : hands) {
            MotionEvent partner = nearestFootMove(hand, feet);
            if (partner == null) continue;
            pairs++;
            if (partner.joint().side() != hand.joint().side()) {
                diagonal++;
            }
        }

        if (pairs < config.minMovePairs()) {
            throw new InsufficientDataException(category(),
                "only " + pairs + " coordinated hand/foot moves, need " + config.minMovePairs());
        }

        double fraction = (double) diagonal / pairs;
        double sway = lateralSway(buffer);

        Map<String, Double> placeholders = new LinkedHashMap<>();
        placeholders.put("diagonal", ExtractorSupport.round(fraction * 100.0, 0));
        placeholders.put("sway", ExtractorSupport.round(sway, 3));
        placeholders.put("events", (double) pairs);
        return RawSignal.of(category(), fraction, placeholders);
    }

    private MotionEvent nearestFootMove(MotionEvent hand, List<MotionEvent> feet) {
        MotionEvent best = null;
        double bestGap = Double.MAX_VALUE;
        for (MotionEvent foot : feet) {
            double gap = Math.abs(foot.timestamp() - hand.timestamp());
            if (gap <= config.pairWindowSeconds() && gap < bestGap) {
                best = foot;
                bestGap = gap;
            }
        }
        return best;
    }

    private static double lateralSway(LandmarkBuffer buffer) {
        List<Double> xs = new ArrayList<>();
        for (BodySample sample : ExtractorSupport.climbingSamples(buffer)) {
            PlanarPoint com = sample.centerOfMass();
            if (com != null) {
                xs.add(com.x());
            }
        }
        return xs.size() < 2 ? 0.0 : stdDev(xs);
    }
}
