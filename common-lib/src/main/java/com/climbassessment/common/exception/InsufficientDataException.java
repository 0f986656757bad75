package com.climbassessment.common.exception;

import com.climbassessment.common.model.MetricCategory;

/**
 * Raised by a feature extractor when the session holds too few valid samples
 * for its category. The category is excluded from aggregation, never defaulted.
 */
public class InsufficientDataException extends AssessmentException {
    private final MetricCategory category;

    public InsufficientDataException(MetricCategory category, String message) {
        super("[" + category.id() + "] " + message);
        this.category = category;
    }

    public MetricCategory getCategory() {
        return category;
    }
}
