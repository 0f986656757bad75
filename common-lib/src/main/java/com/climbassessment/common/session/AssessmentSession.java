package com.climbassessment.common.session;

import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.descent.DescentAnalyzer;
import com.climbassessment.common.exception.EmptySessionException;
import com.climbassessment.common.extractor.ExtractionOutcome;
import com.climbassessment.common.extractor.FeatureExtractionStage;
import com.climbassessment.common.model.AssessmentReport;
import com.climbassessment.common.model.DescentEvent;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.PoseFrame;
import com.climbassessment.common.model.SwotReport;
import com.climbassessment.common.model.TechniqueProfile;
import com.climbassessment.common.model.TensionEvent;
import com.climbassessment.common.scoring.TechniqueProfileScorer;
import com.climbassessment.common.swot.SwotSynthesizer;
import com.climbassessment.common.tension.TensionAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One climbing attempt. Frames may be appended incrementally and feed the
 * tension and descent analyzers as they arrive; nothing is scored until
 * {@link #complete()}, which runs extraction, scoring and SWOT synthesis
 * exactly once. Not thread-safe and not reusable.
 */
public final class AssessmentSession {

    private static final Logger log = LoggerFactory.getLogger(AssessmentSession.class);

    private final String sessionId;
    private final GradeBracket bracket;
    private final LandmarkBuffer buffer;
    private final TensionAnalyzer tension;
    private final DescentAnalyzer descent;
    private final FeatureExtractionStage extraction;
    private final TechniqueProfileScorer scorer;
    private final SwotSynthesizer synthesizer;

    private AssessmentReport report;

    AssessmentSession(String sessionId, GradeBracket bracket, EngineConfig config,
                      FeatureExtractionStage extraction, TechniqueProfileScorer scorer,
                      SwotSynthesizer synthesizer) {
        this.sessionId = sessionId;
        this.bracket = bracket;
        this.buffer = new LandmarkBuffer(sessionId, config.buffer());
        this.tension = new TensionAnalyzer(config.tension());
        this.descent = new DescentAnalyzer(config.descent());
        this.extraction = extraction;
        this.scorer = scorer;
        this.synthesizer = synthesizer;
    }

    /**
     * @return {@code true} when the frame was accepted
     * @throws IllegalStateException if the session has completed
     */
    public boolean append(PoseFrame frame) {
        if (report != null) {
            throw new IllegalStateException("session " + sessionId + " already completed");
        }
        boolean accepted = buffer.append(frame);
        if (accepted) {
            tension.observe(buffer.latestSnapshot());
            descent.observe(buffer.latestSnapshot());
        }
        return accepted;
    }

    /**
     * Terminal signal. Returns the same report on repeated calls.
     *
     * @throws EmptySessionException when no frame was accepted
     */
    public AssessmentReport complete() {
        if (report != null) {
            return report;
        }
        if (buffer.isEmpty()) {
            throw new EmptySessionException(sessionId);
        }
        buffer.seal();
        descent.seal();

        ExtractionOutcome outcome = extraction.extractAll(buffer, bracket);
        TechniqueProfile profile = scorer.score(outcome);
        List<TensionEvent> tensionEvents = tension.events();
        List<DescentEvent> descents = descent.events();
        SwotReport swot = synthesizer.synthesize(profile, tensionEvents, descents);

        report = new AssessmentReport(sessionId, buffer.acceptedFrames(), buffer.droppedFrames(),
            profile, swot, tensionEvents, descents);
        log.info("[AssessmentSession] Completed sessionId={} frames={} dropped={} overall={} grade={} insufficient={} falls={}",
            sessionId, buffer.acceptedFrames(), buffer.droppedFrames(),
            profile.overallScore(), profile.grade(), profile.insufficientData(),
            descents.stream().filter(DescentEvent::isFall).count());
        return report;
    }

    public boolean isCompleted() {
        return report != null;
    }

    public String sessionId() { return sessionId; }
}
