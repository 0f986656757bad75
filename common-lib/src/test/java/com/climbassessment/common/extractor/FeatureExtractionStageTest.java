package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.BufferConfig;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.fixture.ClimbFrames;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.PoseFrame;
import com.climbassessment.common.model.RawSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractionStageTest {

    private static LandmarkBuffer sealed(List<PoseFrame> frames) {
        return sealed(frames, BufferConfig.defaults());
    }

    private static LandmarkBuffer sealed(List<PoseFrame> frames, BufferConfig config) {
        LandmarkBuffer buffer = new LandmarkBuffer("stage", config);
        frames.forEach(buffer::append);
        buffer.seal();
        return buffer;
    }

    /** Diagonal climb whose first two cycles are climbed with the shoulders leaning right. */
    private static List<PoseFrame> leanThenUpright() {
        ClimbFrames climb = ClimbFrames.start()
            .shift(Joint.LEFT_SHOULDER, 0.06, 0)
            .shift(Joint.RIGHT_SHOULDER, 0.06, 0)
            .hold(3.0);
        for (int i = 0; i < 4; i++) {
            if (i == 2) {
                climb.shift(Joint.LEFT_SHOULDER, -0.06, 0).shift(Joint.RIGHT_SHOULDER, -0.06, 0);
            }
            double dy = i % 2 == 0 ? -0.12 : 0.12;
            climb.move(0.3, Joint.RIGHT_WRIST, 0, dy, Joint.LEFT_ANKLE, 0, dy).hold(0.5)
                 .move(0.3, Joint.LEFT_WRIST, 0, dy, Joint.RIGHT_ANKLE, 0, dy).hold(0.5);
        }
        return climb.move(0.1, Joint.RIGHT_WRIST, 0, -0.2).hold(1.0).frames();
    }

    @Test
    @DisplayName("full climb → a signal for every category, nothing insufficient")
    void allCategoriesExtracted() {
        ExtractionOutcome outcome = FeatureExtractionStage.standard(ExtractorConfig.defaults())
            .extractAll(sealed(ClimbFrames.steadyClimb(4)), GradeBracket.SIX_A_TO_SIX_B);

        assertEquals(EnumSet.allOf(MetricCategory.class), outcome.signals().keySet());
        assertTrue(outcome.insufficient().isEmpty());
    }

    @Test
    @DisplayName("climber never moves → every category insufficient, no signals")
    void stillClimberFullyInsufficient() {
        ExtractionOutcome outcome = FeatureExtractionStage.standard(ExtractorConfig.defaults())
            .extractAll(sealed(ClimbFrames.start().hold(3.0).frames()), GradeBracket.SIX_A_TO_SIX_B);

        assertEquals(List.of(MetricCategory.values()), outcome.insufficient());
        assertTrue(outcome.signals().isEmpty());
    }

    @Test
    @DisplayName("one extractor failing → other categories unaffected, order by category")
    void failureIsolated() {
        FeatureExtractor failing = new FeatureExtractor() {
            @Override
            public MetricCategory category() { return MetricCategory.RHYTHM; }

            @Override
            public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
                throw new InsufficientDataException(MetricCategory.RHYTHM, "no data");
            }
        };
        FeatureExtractor constant = new FeatureExtractor() {
            @Override
            public MetricCategory category() { return MetricCategory.QUIET_FEET; }

            @Override
            public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
                return RawSignal.of(MetricCategory.QUIET_FEET, -0.5, Map.of());
            }
        };

        ExtractionOutcome outcome = new FeatureExtractionStage(List.of(failing, constant))
            .extractAll(sealed(ClimbFrames.start().hold(1.0).frames()), GradeBracket.SIX_A_TO_SIX_B);

        assertEquals(List.of(MetricCategory.RHYTHM), outcome.insufficient());
        assertEquals(-0.5, outcome.signals().get(MetricCategory.QUIET_FEET).value());
    }

    @Test
    @DisplayName("extractor throws an unexpected runtime exception → its category insufficient, the rest still extracted")
    void unexpectedFailureIsolated() {
        FeatureExtractor broken = new FeatureExtractor() {
            @Override
            public MetricCategory category() { return MetricCategory.HIP_POSITION; }

            @Override
            public RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket) {
                throw new IllegalStateException("corrupt track");
            }
        };
        List<FeatureExtractor> extractors = List.of(broken, new QuietFeetExtractor(ExtractorConfig.defaults()));

        ExtractionOutcome outcome = new FeatureExtractionStage(extractors)
            .extractAll(sealed(ClimbFrames.steadyClimb(4)), GradeBracket.SIX_A_TO_SIX_B);

        assertEquals(List.of(MetricCategory.HIP_POSITION), outcome.insufficient());
        assertEquals(EnumSet.of(MetricCategory.QUIET_FEET), outcome.signals().keySet());
    }

    @Test
    @DisplayName("session longer than the joint ring → same outcome as a buffer holding every frame")
    void outcomeIndependentOfRingCapacity() {
        List<PoseFrame> frames = leanThenUpright();
        BufferConfig small = BufferConfig.defaults().withCapacity(60);
        FeatureExtractionStage stage = FeatureExtractionStage.standard(ExtractorConfig.defaults());

        ExtractionOutcome bounded = stage.extractAll(sealed(frames, small), GradeBracket.SIX_A_TO_SIX_B);
        ExtractionOutcome unbounded = stage.extractAll(sealed(frames), GradeBracket.SIX_A_TO_SIX_B);

        assertTrue(frames.size() > 4 * small.capacity());
        assertEquals(unbounded, bounded);
        // the lean is only in the evicted early frames
        double lean = Math.toDegrees(Math.atan2(0.06, 0.2));
        double hip = bounded.signals().get(MetricCategory.HIP_POSITION).value();
        assertTrue(hip > 1.0 && hip < lean, "hip angle " + hip);
    }
}
