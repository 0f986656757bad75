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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Extractors over synthetic climbs with known kinematics.
 */
class FeatureExtractorsTest {

    private static final ExtractorConfig CONFIG = ExtractorConfig.defaults();
    private static final GradeBracket BRACKET = GradeBracket.SIX_A_TO_SIX_B;

    private static LandmarkBuffer sealed(List<PoseFrame> frames) {
        LandmarkBuffer buffer = new LandmarkBuffer("test", BufferConfig.defaults());
        frames.forEach(buffer::append);
        buffer.seal();
        return buffer;
    }

    private static final LandmarkBuffer STEADY = sealed(ClimbFrames.steadyClimb(4));

    /** One second still, one right-hand move, then a second of rest. */
    private static ClimbFrames singleMove(ClimbFrames climb) {
        return climb.hold(1.0).move(0.3, Joint.RIGHT_WRIST, 0, -0.12).hold(1.0);
    }

    // ── quiet_feet ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("QuietFeetExtractor")
    class QuietFeet {

        private final QuietFeetExtractor extractor = new QuietFeetExtractor(CONFIG);

        @Test
        @DisplayName("every foot move lands on a new hold → no repositions, deviation −1")
        void cleanFootwork() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertEquals(MetricCategory.QUIET_FEET, signal.category());
            assertEquals(-1.0, signal.value(), 1e-9);
            assertEquals(0.0, signal.placeholders().get("repositions"));
            assertEquals(8.0, signal.placeholders().get("holds"));
            assertEquals(1.5, signal.placeholders().get("norm"));
        }

        @Test
        @DisplayName("small re-settle on the same hold → counted as reposition against the bracket norm")
        void repositionCounted() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(1.0)
                .move(0.3, Joint.LEFT_ANKLE, 0, -0.12)
                .hold(0.5)
                .move(0.3, Joint.RIGHT_ANKLE, 0, -0.12)
                .hold(0.5)
                .move(2 / ClimbFrames.FPS, Joint.LEFT_ANKLE, 0.025, 0)
                .hold(0.5)
                .frames();
            LandmarkBuffer buffer = sealed(frames);

            RawSignal sixA = extractor.extract(buffer, GradeBracket.SIX_A_TO_SIX_B);
            assertEquals(2.0, sixA.placeholders().get("holds"));
            assertEquals(0.5, sixA.placeholders().get("repositions"));
            assertEquals((0.5 - 1.5) / 1.5, sixA.value(), 1e-9);

            RawSignal sevenB = extractor.extract(buffer, GradeBracket.SEVEN_B_PLUS);
            assertEquals(0.0, sevenB.value(), 1e-9);
        }

        @Test
        @DisplayName("feet settle in the starting stance but never move → InsufficientDataException")
        void startingStanceIsNotAHold() {
            LandmarkBuffer buffer = sealed(singleMove(ClimbFrames.start()).hold(3.0).frames());

            InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> extractor.extract(buffer, BRACKET));
            assertEquals(MetricCategory.QUIET_FEET, e.getCategory());
        }

        @Test
        @DisplayName("feet never visible → InsufficientDataException")
        void noFootHolds() {
            LandmarkBuffer buffer = sealed(singleMove(ClimbFrames.start()
                .hide(Joint.LEFT_ANKLE, Joint.RIGHT_ANKLE)).frames());

            InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> extractor.extract(buffer, BRACKET));
            assertEquals(MetricCategory.QUIET_FEET, e.getCategory());
        }
    }

    // ── hip_position ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("HipPositionExtractor")
    class HipPosition {

        private final HipPositionExtractor extractor = new HipPositionExtractor(CONFIG);

        @Test
        @DisplayName("upright trunk → 0°")
        void upright() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);
            assertEquals(0.0, signal.value(), 1e-9);
            assertEquals(0.0, signal.placeholders().get("overload"));
        }

        @Test
        @DisplayName("shoulders offset 10° from vertical → 10°, overload 10 %")
        void leaning() {
            double dx = 0.2 * Math.tan(Math.toRadians(10.0));
            ClimbFrames climb = ClimbFrames.start()
                .shift(Joint.LEFT_SHOULDER, dx, 0)
                .shift(Joint.RIGHT_SHOULDER, dx, 0);
            RawSignal signal = extractor.extract(sealed(singleMove(climb).frames()), BRACKET);

            assertEquals(10.0, signal.value(), 1e-6);
            assertEquals(10.0, signal.placeholders().get("angle"));
            assertEquals(10.0, signal.placeholders().get("overload"));
        }

        @Test
        @DisplayName("climber never moves → no climbing frames → insufficient")
        void noClimbing() {
            LandmarkBuffer buffer = sealed(ClimbFrames.start().hold(3.0).frames());
            assertThrows(InsufficientDataException.class, () -> extractor.extract(buffer, BRACKET));
        }

        @Test
        @DisplayName("hips occluded → insufficient")
        void hipsOccluded() {
            LandmarkBuffer buffer = sealed(singleMove(ClimbFrames.start()
                .hide(Joint.LEFT_HIP, Joint.RIGHT_HIP)).frames());
            assertThrows(InsufficientDataException.class, () -> extractor.extract(buffer, BRACKET));
        }
    }

    // ── diagonal ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("DiagonalCoordinationExtractor")
    class Diagonal {

        private final DiagonalCoordinationExtractor extractor = new DiagonalCoordinationExtractor(CONFIG);

        @Test
        @DisplayName("hand always moves with the opposite foot → fraction 1.0, no sway")
        void contralateral() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertEquals(1.0, signal.value(), 1e-9);
            assertEquals(100.0, signal.placeholders().get("diagonal"));
            assertEquals(8.0, signal.placeholders().get("events"));
            assertEquals(0.0, signal.placeholders().get("sway"));
        }

        @Test
        @DisplayName("hand always moves with the same-side foot → fraction 0.0")
        void ipsilateral() {
            ClimbFrames climb = ClimbFrames.start().hold(1.0);
            for (int i = 0; i < 3; i++) {
                double dy = i % 2 == 0 ? -0.12 : 0.12;
                climb.move(0.3, Joint.RIGHT_WRIST, 0, dy, Joint.RIGHT_ANKLE, 0, dy).hold(0.5);
            }
            RawSignal signal = extractor.extract(sealed(climb.frames()), BRACKET);

            assertEquals(0.0, signal.value(), 1e-9);
            assertEquals(3.0, signal.placeholders().get("events"));
        }

        @Test
        @DisplayName("hands only, no foot moves → no pairs → insufficient")
        void noPairs() {
            LandmarkBuffer buffer = sealed(singleMove(ClimbFrames.start()).frames());
            assertThrows(InsufficientDataException.class, () -> extractor.extract(buffer, BRACKET));
        }
    }

    // ── route_reading ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("RouteReadingExtractor")
    class RouteReading {

        private final RouteReadingExtractor extractor = new RouteReadingExtractor(CONFIG);

        @Test
        @DisplayName("3 s preview, no pauses → planning 3 s")
        void previewOnly() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertEquals(3.0, signal.value(), 1e-9);
            assertEquals(3.0, signal.placeholders().get("preview"));
            assertEquals(0.0, signal.placeholders().get("pauses"));
        }

        @Test
        @DisplayName("2 s preview + one mid-climb pause → planning 2 + 1.5 s")
        void pauseCredited() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(2.0)
                .move(0.3, Joint.RIGHT_WRIST, 0, -0.12)
                .hold(2.0)
                .move(0.3, Joint.LEFT_WRIST, 0, -0.12)
                .hold(0.5)
                .frames();
            RawSignal signal = extractor.extract(sealed(frames), BRACKET);

            assertEquals(3.5, signal.value(), 1e-9);
            assertEquals(1.0, signal.placeholders().get("pauses"));
        }

        @Test
        @DisplayName("no movement at all → insufficient")
        void noMovement() {
            LandmarkBuffer buffer = sealed(ClimbFrames.start().hold(2.0).frames());
            assertThrows(InsufficientDataException.class, () -> extractor.extract(buffer, BRACKET));
        }
    }

    // ── rhythm ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("RhythmExtractor")
    class Rhythm {

        private final RhythmExtractor extractor = new RhythmExtractor(CONFIG);

        @Test
        @DisplayName("hand moves every 0.8 s → near-zero spread")
        void evenRhythm() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertTrue(signal.value() < 1.0, "spread was " + signal.value());
            assertEquals(0.8, signal.placeholders().get("interval"));
            assertEquals(9.0, signal.placeholders().get("moves"));
        }

        @Test
        @DisplayName("uneven intervals → spread in milliseconds")
        void unevenRhythm() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(1.0)
                .move(0.3, Joint.RIGHT_WRIST, 0, -0.12).hold(0.3)
                .move(0.3, Joint.LEFT_WRIST, 0, -0.12).hold(0.9)
                .move(0.3, Joint.RIGHT_WRIST, 0, 0.12).hold(0.3)
                .move(0.3, Joint.LEFT_WRIST, 0, 0.12).hold(0.9)
                .frames();
            RawSignal signal = extractor.extract(sealed(frames), BRACKET);

            // intervals 0.6, 1.2, 0.6 s → population std 282.8 ms
            assertEquals(Math.sqrt(0.08) * 1000.0, signal.value(), 1e-6);
        }

        @Test
        @DisplayName("two hand moves → one interval → insufficient")
        void tooFewMoves() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(1.0)
                .move(0.3, Joint.RIGHT_WRIST, 0, -0.12).hold(0.5)
                .move(0.3, Joint.LEFT_WRIST, 0, -0.12).hold(0.5)
                .frames();
            assertThrows(InsufficientDataException.class, () -> extractor.extract(sealed(frames), BRACKET));
        }
    }

    // ── dynamic_control ────────────────────────────────────────────────────

    @Nested
    @DisplayName("DynamicControlExtractor")
    class DynamicControl {

        private final DynamicControlExtractor extractor = new DynamicControlExtractor(CONFIG);

        @Test
        @DisplayName("hand settles right after the dynamic move → settle time of two frames")
        void quickSettle() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertEquals(2 / ClimbFrames.FPS, signal.value(), 1e-9);
            assertEquals(1.0, signal.placeholders().get("moves"));
        }

        @Test
        @DisplayName("hand never settles → charged the timeout")
        void neverSettles() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(0.5)
                .move(0.1, Joint.RIGHT_WRIST, 0, -0.2)
                .frames();
            RawSignal signal = extractor.extract(sealed(frames), BRACKET);

            assertEquals(CONFIG.settleTimeoutSeconds(), signal.value(), 1e-9);
        }

        @Test
        @DisplayName("no dynamic moves → insufficient")
        void noDynamics() {
            LandmarkBuffer buffer = sealed(singleMove(ClimbFrames.start()).frames());
            assertThrows(InsufficientDataException.class, () -> extractor.extract(buffer, BRACKET));
        }
    }

    // ── grip_release ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("GripReleaseExtractor")
    class GripRelease {

        private final GripReleaseExtractor extractor = new GripReleaseExtractor(CONFIG);

        @Test
        @DisplayName("every hand move is a measurable release")
        void releasesMeasured() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertEquals(9.0, signal.placeholders().get("releases"));
            assertTrue(signal.value() > 0.0);
        }

        @Test
        @DisplayName("sharper release → higher jerk")
        void sharperIsWorse() {
            ClimbFrames smooth = ClimbFrames.start().hold(1.0);
            ClimbFrames sharp = ClimbFrames.start().hold(1.0);
            for (int i = 0; i < 3; i++) {
                double dy = i % 2 == 0 ? -0.12 : 0.12;
                smooth.move(0.3, Joint.RIGHT_WRIST, 0, dy).hold(0.6);
                sharp.move(0.1, Joint.RIGHT_WRIST, 0, dy).hold(0.6);
            }

            double smoothJerk = extractor.extract(sealed(smooth.frames()), BRACKET).value();
            double sharpJerk = extractor.extract(sealed(sharp.frames()), BRACKET).value();
            assertTrue(sharpJerk > smoothJerk, sharpJerk + " <= " + smoothJerk);
        }

        @Test
        @DisplayName("one release → insufficient")
        void tooFewReleases() {
            LandmarkBuffer buffer = sealed(singleMove(ClimbFrames.start()).frames());
            assertThrows(InsufficientDataException.class, () -> extractor.extract(buffer, BRACKET));
        }
    }

    // ── exhaustion ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ExhaustionExtractor")
    class Exhaustion {

        private final ExhaustionExtractor extractor = new ExhaustionExtractor(CONFIG);

        @Test
        @DisplayName("steady centre of mass throughout → no degradation")
        void steady() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(1.0)
                .move(0.3, Joint.RIGHT_WRIST, 0, -0.12)
                .hold(2.0)
                .frames();
            RawSignal signal = extractor.extract(sealed(frames), BRACKET);

            assertEquals(0.0, signal.value(), 1e-9);
            assertEquals(0.0, signal.placeholders().get("percent"));
        }

        @Test
        @DisplayName("hips shaking in the last quarter only → 100 % degradation")
        void shakyFinish() {
            ClimbFrames climb = ClimbFrames.start()
                .hold(1.0)
                .move(0.3, Joint.RIGHT_WRIST, 0, -0.12)
                .hold(2.0);
            for (int i = 0; i < 20; i++) {
                climb.shift(Joint.LEFT_HIP, 0.01, 0).hold(1 / ClimbFrames.FPS)
                     .shift(Joint.LEFT_HIP, -0.01, 0).hold(1 / ClimbFrames.FPS);
            }
            RawSignal signal = extractor.extract(sealed(climb.frames()), BRACKET);

            assertEquals(100.0, signal.value(), 1e-9);
            assertEquals(100.0, signal.placeholders().get("percent"));
        }

        @Test
        @DisplayName("fewer than 40 climbing frames → insufficient")
        void tooShort() {
            List<PoseFrame> frames = ClimbFrames.start()
                .hold(1.0)
                .move(0.3, Joint.RIGHT_WRIST, 0, -0.12)
                .hold(0.5)
                .frames();
            assertThrows(InsufficientDataException.class, () -> extractor.extract(sealed(frames), BRACKET));
        }
    }

    // ── arm_load ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ArmLoadExtractor")
    class ArmLoad {

        private final ArmLoadExtractor extractor = new ArmLoadExtractor(CONFIG);

        @Test
        @DisplayName("arm and leg shares add up to 100 %")
        void sharesComplement() {
            RawSignal signal = extractor.extract(STEADY, BRACKET);

            assertTrue(signal.value() > 0.0 && signal.value() < 100.0);
            assertEquals(100.0, signal.placeholders().get("arm_load") + signal.placeholders().get("leg_load"), 1.0);
        }

        @Test
        @DisplayName("hands lowered towards the hips → arm share drops")
        void lowerHandsLessArmLoad() {
            ClimbFrames reaching = ClimbFrames.start();
            ClimbFrames crouched = ClimbFrames.start()
                .shift(Joint.LEFT_WRIST, 0, 0.2)
                .shift(Joint.RIGHT_WRIST, 0, 0.2);

            double reachingLoad = extractor.extract(sealed(singleMove(reaching).frames()), BRACKET).value();
            double crouchedLoad = extractor.extract(sealed(singleMove(crouched).frames()), BRACKET).value();
            assertTrue(crouchedLoad < reachingLoad, crouchedLoad + " >= " + reachingLoad);
        }
    }
}
