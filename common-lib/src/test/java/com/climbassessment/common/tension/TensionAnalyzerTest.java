package com.climbassessment.common.tension;

import com.climbassessment.common.buffer.BufferConfig;
import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.fixture.ClimbFrames;
import com.climbassessment.common.model.BodyRegion;
import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.PoseFrame;
import com.climbassessment.common.model.Side;
import com.climbassessment.common.model.TensionEvent;
import com.climbassessment.common.model.TensionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rising-edge counting per region and side over synthetic poses.
 */
class TensionAnalyzerTest {

    private static List<TensionEvent> analyze(List<PoseFrame> frames) {
        LandmarkBuffer buffer = new LandmarkBuffer("tension", BufferConfig.defaults());
        TensionAnalyzer analyzer = new TensionAnalyzer(TensionThresholds.defaults());
        for (PoseFrame frame : frames) {
            if (buffer.append(frame)) {
                analyzer.observe(buffer.latestSnapshot());
            }
        }
        return analyzer.events();
    }

    @Test
    @DisplayName("neutral stance → no tension events")
    void neutralStance() {
        assertTrue(analyze(ClimbFrames.start().hold(1.0).frames()).isEmpty());
    }

    @Test
    @DisplayName("left elbow bent below 70° twice → count 2 on the left only, minimum angle kept")
    void elbowLockCountedPerSide() {
        List<PoseFrame> frames = ClimbFrames.start()
            .hold(0.1)
            .shift(Joint.LEFT_WRIST, 0.09, 0.05).hold(0.1)
            .shift(Joint.LEFT_WRIST, -0.09, -0.05).hold(0.1)
            .shift(Joint.LEFT_WRIST, 0.09, 0.05).hold(0.1)
            .frames();

        List<TensionEvent> events = analyze(frames);

        assertEquals(1, events.size());
        TensionEvent elbow = events.get(0);
        assertEquals(BodyRegion.ELBOW, elbow.region());
        assertEquals(TensionKind.ANGLE_LOCK, elbow.kind());
        assertEquals(Side.LEFT, elbow.side());
        assertEquals(2, elbow.count());
        assertEquals(60.1, elbow.extremum(), 0.1);
    }

    @Test
    @DisplayName("staying over the threshold → one crossing, not one per frame")
    void sustainedCrossingCountsOnce() {
        List<PoseFrame> frames = ClimbFrames.start()
            .shift(Joint.LEFT_WRIST, 0.09, 0.05)
            .hold(2.0)
            .frames();

        assertEquals(1, analyze(frames).get(0).count());
    }

    @Test
    @DisplayName("shoulder line rotated 45° against the hips → lower-back twist, no side")
    void lowerBackTwist() {
        List<PoseFrame> frames = ClimbFrames.start()
            .hold(0.1)
            .shift(Joint.LEFT_SHOULDER, 0, 0.05)
            .shift(Joint.RIGHT_SHOULDER, 0, -0.05)
            .hold(0.1)
            .frames();

        List<TensionEvent> events = analyze(frames);

        assertEquals(1, events.size());
        assertEquals(BodyRegion.LOWER_BACK, events.get(0).region());
        assertEquals(Side.NONE, events.get(0).side());
        assertEquals(45.0, events.get(0).extremum(), 0.1);
    }

    @Test
    @DisplayName("knee pushed sideways past 15 % of frame width → rotation on that side")
    void kneeRotation() {
        List<PoseFrame> frames = ClimbFrames.start()
            .hold(0.1)
            .shift(Joint.RIGHT_KNEE, 0.2, 0)
            .hold(0.1)
            .frames();

        List<TensionEvent> events = analyze(frames);

        assertEquals(1, events.size());
        assertEquals(BodyRegion.KNEE, events.get(0).region());
        assertEquals(TensionKind.ROTATION, events.get(0).kind());
        assertEquals(Side.RIGHT, events.get(0).side());
        assertEquals(22.0, events.get(0).extremum(), 0.1);
    }

    @Test
    @DisplayName("elbow occluded between two bent frames → gap does not split the crossing")
    void gapDoesNotSplitCrossing() {
        List<PoseFrame> frames = ClimbFrames.start()
            .shift(Joint.LEFT_WRIST, 0.09, 0.05)
            .hold(0.1)
            .hide(Joint.LEFT_ELBOW)
            .hold(1.0)
            .show(Joint.LEFT_ELBOW)
            .hold(0.1)
            .frames();

        assertEquals(1, analyze(frames).get(0).count());
    }
}
