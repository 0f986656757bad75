package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Injury-relevant regions watched by the tension analyzer. */
public enum BodyRegion {
    SHOULDER,
    ELBOW,
    KNEE,
    LOWER_BACK;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
