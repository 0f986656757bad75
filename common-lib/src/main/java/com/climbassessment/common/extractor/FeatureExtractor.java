package com.climbassessment.common.extractor;

import com.climbassessment.common.buffer.LandmarkBuffer;
import com.climbassessment.common.exception.InsufficientDataException;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.MetricCategory;
import com.climbassessment.common.model.RawSignal;

/**
 * Turns a session's full landmark buffer into the raw signal of one category.
 * Implementations are stateless and may be shared across sessions.
 */
public interface FeatureExtractor {

    MetricCategory category();

    /**
     * @param buffer  sealed buffer of the whole session
     * @param bracket the climber's grade bracket, used by categories with grade-specific norms
     * @throws InsufficientDataException when the session holds too few valid samples or events
     */
    RawSignal extract(LandmarkBuffer buffer, GradeBracket bracket);
}
