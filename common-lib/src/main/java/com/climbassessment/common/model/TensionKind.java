package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TensionKind {
    ANGLE_LOCK,
    ROTATION,
    TWIST;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
