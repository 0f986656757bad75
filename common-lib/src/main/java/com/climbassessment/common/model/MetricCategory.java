package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Scored categories. The seven technique categories feed the weighted overall
 * score; auxiliary categories ({@link #EXHAUSTION}, {@link #ARM_LOAD}) only feed
 * the SWOT narrative and threat rules.
 */
public enum MetricCategory {
    QUIET_FEET("quiet_feet", true, LevelFamily.GENERIC),
    HIP_POSITION("hip_position", true, LevelFamily.GENERIC),
    DIAGONAL("diagonal", true, LevelFamily.GENERIC),
    ROUTE_READING("route_reading", true, LevelFamily.GENERIC),
    RHYTHM("rhythm", true, LevelFamily.GENERIC),
    DYNAMIC_CONTROL("dynamic_control", true, LevelFamily.GENERIC),
    GRIP_RELEASE("grip_release", true, LevelFamily.GENERIC),
    EXHAUSTION("exhaustion", false, LevelFamily.EXHAUSTION),
    ARM_LOAD("arm_load", false, LevelFamily.LOAD);

    private final String id;
    private final boolean technique;
    private final LevelFamily family;

    MetricCategory(String id, boolean technique, LevelFamily family) {
        this.id = id;
        this.technique = technique;
        this.family = family;
    }

    @JsonValue
    public String id() { return id; }

    public boolean isTechnique() { return technique; }

    public LevelFamily family() { return family; }

    public static Optional<MetricCategory> fromId(String id) {
        return Arrays.stream(values())
            .filter(category -> category.id.equals(id))
            .findFirst();
    }
}
