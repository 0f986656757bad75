package com.climbassessment.common.session;

import com.climbassessment.common.buffer.BufferConfig;
import com.climbassessment.common.descent.DescentThresholds;
import com.climbassessment.common.extractor.ExtractorConfig;
import com.climbassessment.common.scoring.ScoringConfig;
import com.climbassessment.common.swot.SwotLimits;
import com.climbassessment.common.tension.TensionThresholds;

/** All immutable configuration shared by the sessions of one engine. */
public record EngineConfig(
    BufferConfig buffer,
    ExtractorConfig extractor,
    TensionThresholds tension,
    DescentThresholds descent,
    ScoringConfig scoring,
    SwotLimits swot
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
            BufferConfig.defaults(),
            ExtractorConfig.defaults(),
            TensionThresholds.defaults(),
            DescentThresholds.defaults(),
            ScoringConfig.defaults(),
            SwotLimits.defaults());
    }

    public EngineConfig withBuffer(BufferConfig newBuffer) {
        return new EngineConfig(newBuffer, extractor, tension, descent, scoring, swot);
    }

    public EngineConfig withScoring(ScoringConfig newScoring) {
        return new EngineConfig(buffer, extractor, tension, descent, newScoring, swot);
    }
}
