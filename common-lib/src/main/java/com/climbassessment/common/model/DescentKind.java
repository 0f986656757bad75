package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a downward centre-of-mass episode: an even, deliberate descent
 * (down-climbing, stepping off) or an uncontrolled fall.
 */
public enum DescentKind {
    CONTROLLED,
    FALL;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
