package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Coarse grade brackets used to pick the foot-precision norm for a climber.
 */
public enum GradeBracket {
    FIVE_A_TO_FIVE_C("5a-5c"),
    SIX_A_TO_SIX_B("6a-6b"),
    SIX_C_TO_SEVEN_A("6c-7a"),
    SEVEN_B_PLUS("7b+");

    private final String label;

    GradeBracket(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() { return label; }

    @JsonCreator
    public static GradeBracket fromLabel(String label) {
        return Arrays.stream(values())
            .filter(bracket -> bracket.label.equalsIgnoreCase(label) || bracket.name().equalsIgnoreCase(label))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown grade bracket: " + label));
    }
}
