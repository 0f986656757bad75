package com.climbassessment.common.session;

import com.climbassessment.common.exception.EmptySessionException;
import com.climbassessment.common.extractor.FeatureExtractionStage;
import com.climbassessment.common.model.AssessmentReport;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.PoseFrame;
import com.climbassessment.common.scoring.TechniqueProfileScorer;
import com.climbassessment.common.swot.SwotSynthesizer;
import com.climbassessment.common.template.TemplateSet;

import java.util.List;

/**
 * Entry point of the assessment core.
 *
 * <p>Holds only immutable, shareable state (configuration, template set and
 * the stateless pipeline stages built from them). Every call to
 * {@link #newSession} returns a session with its own buffer, tension and descent
 * analyzers, so concurrent sessions never share mutable state.
 */
public final class AssessmentEngine {

    private final EngineConfig config;
    private final TemplateSet templates;
    private final FeatureExtractionStage extraction;
    private final TechniqueProfileScorer scorer;
    private final SwotSynthesizer synthesizer;

    public AssessmentEngine(EngineConfig config, TemplateSet templates) {
        this.config = config;
        this.templates = templates;
        this.extraction = FeatureExtractionStage.standard(config.extractor());
        this.scorer = new TechniqueProfileScorer(config.scoring());
        this.synthesizer = SwotSynthesizer.standard(templates, config.swot());
    }

    public AssessmentSession newSession(String sessionId, GradeBracket bracket) {
        return new AssessmentSession(sessionId, bracket, config, extraction, scorer, synthesizer);
    }

    /**
     * Batch convenience: appends every frame to a fresh session and completes it.
     *
     * @throws EmptySessionException when {@code frames} is null or empty, or no frame was accepted
     */
    public AssessmentReport assess(String sessionId, GradeBracket bracket, List<PoseFrame> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new EmptySessionException(sessionId);
        }
        AssessmentSession session = newSession(sessionId, bracket);
        frames.forEach(session::append);
        return session.complete();
    }

    public EngineConfig config() { return config; }

    public TemplateSet templates() { return templates; }
}
