package com.climbassessment.common.buffer;

import com.climbassessment.common.model.Joint;
import com.climbassessment.common.model.Landmark;
import com.climbassessment.common.model.PoseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rolling per-joint landmark history for one session.
 *
 * <h3>Append contract</h3>
 * <ul>
 *   <li>Frames must arrive with strictly increasing {@code frameIndex} and
 *       {@code timestamp}; anything else is dropped and logged once per session.</li>
 *   <li>Every accepted frame appends exactly one sample to every joint track,
 *       so position {@code i} refers to the same frame in all tracks.</li>
 *   <li>A landmark that is missing, below its joint's confidence floor, or
 *       non-physical is replaced by the joint's last observed position for at
 *       most {@link BufferConfig#maxHoldSeconds()}; after that the joint is
 *       {@link SampleState#LOST} until it is observed again.</li>
 *   <li>Past capacity the oldest joint sample is overwritten. The motion
 *       event log and the per-frame {@link BodySample} log are maintained on
 *       append and are never evicted.</li>
 * </ul>
 *
 * <p>Not thread-safe: a buffer belongs to exactly one session.
 */
public final class LandmarkBuffer {

    private static final Logger log = LoggerFactory.getLogger(LandmarkBuffer.class);

    private final String sessionId;
    private final BufferConfig config;
    private final Map<Joint, JointTrack> tracks = new EnumMap<>(Joint.class);
    private final MotionDetector motion;
    private final List<BodySample> body = new ArrayList<>();
    private final Set<String> reported = new HashSet<>();

    private FrameSnapshot latestSnapshot;
    private long lastFrameIndex;
    private double firstTimestamp = Double.NaN;
    private double lastTimestamp = Double.NaN;
    private int accepted;
    private int dropped;
    private boolean sealed;

    public LandmarkBuffer(String sessionId, BufferConfig config) {
        this.sessionId = sessionId;
        this.config = config;
        for (Joint joint : Joint.values()) {
            tracks.put(joint, new JointTrack(config.capacity()));
        }
        this.motion = new MotionDetector(config);
    }

    // ── Ingestion ──────────────────────────────────────────────────

    /**
     * Appends one frame.
     *
     * @return {@code true} when the frame was accepted, {@code false} when it was dropped
     * @throws IllegalStateException if the buffer has been sealed
     */
    public boolean append(PoseFrame frame) {
        if (sealed) {
            throw new IllegalStateException("buffer for session " + sessionId + " is sealed");
        }
        if (frame == null) {
            dropped++;
            reportOnce("frame-null", () -> log.warn("[LandmarkBuffer] Null frame dropped sessionId={}", sessionId));
            return false;
        }
        if (!Double.isFinite(frame.timestamp())
                || (accepted > 0 && (frame.frameIndex() <= lastFrameIndex || frame.timestamp() <= lastTimestamp))) {
            dropped++;
            reportOnce("frame-order", () -> log.warn(
                "[LandmarkBuffer] Out-of-order frame dropped sessionId={} frameIndex={} timestamp={} lastFrameIndex={}",
                sessionId, frame.frameIndex(), frame.timestamp(), lastFrameIndex));
            return false;
        }

        boolean evicted = false;
        for (Joint joint : Joint.values()) {
            JointTrack track = tracks.get(joint);
            evicted |= track.append(resolve(joint, track, frame));
        }
        if (evicted) {
            reportOnce("eviction", () -> log.info(
                "[LandmarkBuffer] Capacity reached, evicting oldest samples sessionId={} capacity={}",
                sessionId, config.capacity()));
        }

        if (accepted == 0) {
            firstTimestamp = frame.timestamp();
        }
        accepted++;
        lastFrameIndex = frame.frameIndex();
        lastTimestamp = frame.timestamp();

        FrameSnapshot previous = latestSnapshot;
        latestSnapshot = snapshot(size() - 1);
        body.add(BodySample.of(latestSnapshot));
        if (previous != null) {
            motion.observe(previous, latestSnapshot);
        }
        return true;
    }

    private JointSample resolve(Joint joint, JointTrack track, PoseFrame frame) {
        Landmark landmark = frame.landmark(joint);
        if (landmark != null && !landmark.isPhysical()) {
            reportOnce("malformed-" + joint.wireName(), () -> log.warn(
                "[LandmarkBuffer] Impossible landmark values ignored sessionId={} joint={} frameIndex={}",
                sessionId, joint.wireName(), frame.frameIndex()));
            landmark = null;
        } else if (landmark != null && landmark.confidence() < config.minConfidence(joint)) {
            reportOnce("low-confidence-" + joint.wireName(), () -> log.debug(
                "[LandmarkBuffer] Low-confidence landmark rejected sessionId={} joint={} confidence={} min={}",
                sessionId, joint.wireName(), frame.landmark(joint).confidence(), config.minConfidence(joint)));
            landmark = null;
        }

        if (landmark != null) {
            return new JointSample(frame.frameIndex(), frame.timestamp(),
                landmark.x(), landmark.y(), landmark.z(), landmark.confidence(), SampleState.OBSERVED);
        }
        JointSample last = track.lastObserved();
        if (last != null && frame.timestamp() - last.timestamp() <= config.maxHoldSeconds()) {
            return last.heldAt(frame.frameIndex(), frame.timestamp());
        }
        JointSample previous = track.latest();
        if (previous != null && previous.isUsable()) {
            log.debug("[LandmarkBuffer] Joint lost sessionId={} joint={} frameIndex={}",
                sessionId, joint.wireName(), frame.frameIndex());
        }
        return JointSample.lost(frame.frameIndex(), frame.timestamp());
    }

    /** Marks the end of the stream. Further appends throw. */
    public void seal() {
        if (!sealed) {
            sealed = true;
            motion.seal();
        }
    }

    private void reportOnce(String key, Runnable logAction) {
        if (reported.add(key)) {
            logAction.run();
        }
    }

    // ── Queries ────────────────────────────────────────────────────

    /** Number of frames currently retained (at most the capacity). */
    public int size() {
        return tracks.get(Joint.LEFT_HIP).size();
    }

    public boolean isEmpty() {
        return accepted == 0;
    }

    public int acceptedFrames() { return accepted; }

    public int droppedFrames() { return dropped; }

    public boolean isSealed() { return sealed; }

    public String sessionId() { return sessionId; }

    public BufferConfig config() { return config; }

    /** Timestamp of the first accepted frame, retained after eviction; {@code NaN} when empty. */
    public double firstTimestamp() { return firstTimestamp; }

    public double lastTimestamp() { return lastTimestamp; }

    public JointSample sample(Joint joint, int position) {
        return tracks.get(joint).get(position);
    }

    /** All retained samples for {@code joint}, oldest first. */
    public List<JointSample> samples(Joint joint) {
        return tracks.get(joint).snapshot();
    }

    public FrameSnapshot snapshot(int position) {
        Map<Joint, JointSample> samples = new EnumMap<>(Joint.class);
        for (Map.Entry<Joint, JointTrack> entry : tracks.entrySet()) {
            samples.put(entry.getKey(), entry.getValue().get(position));
        }
        JointSample reference = samples.get(Joint.LEFT_HIP);
        return new FrameSnapshot(position, reference.frameIndex(), reference.timestamp(), samples);
    }

    /** Snapshot of the most recently accepted frame; {@code null} when empty. */
    public FrameSnapshot latestSnapshot() {
        return latestSnapshot;
    }

    /** Whole-body measurements of every accepted frame, oldest first, never evicted. */
    public List<BodySample> bodySamples() {
        return Collections.unmodifiableList(body);
    }

    /**
     * Most recent samples for {@code joint} covering at least {@code durationSeconds},
     * oldest first. Returns everything retained when the session is shorter; never pads.
     */
    public List<JointSample> window(Joint joint, double durationSeconds) {
        JointTrack track = tracks.get(joint);
        Deque<JointSample> recent = new ArrayDeque<>();
        if (track.size() == 0) {
            return List.of();
        }
        double newest = track.latest().timestamp();
        for (int i = track.size() - 1; i >= 0; i--) {
            JointSample sample = track.get(i);
            recent.addFirst(sample);
            if (newest - sample.timestamp() >= durationSeconds) {
                break;
            }
        }
        return List.copyOf(recent);
    }

    /** Motion event log in detection order. */
    public List<MotionEvent> events() {
        return motion.events();
    }

    public List<MotionEvent> events(MotionEventKind kind) {
        return motion.events().stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toUnmodifiableList());
    }
}
