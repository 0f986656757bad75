package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output of one assessment session, free of presentation formatting.
 */
public record AssessmentReport(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("framesAccepted") int framesAccepted,
    @JsonProperty("framesDropped") int framesDropped,
    @JsonProperty("profile") TechniqueProfile profile,
    @JsonProperty("swot") SwotReport swot,
    @JsonProperty("tensionEvents") List<TensionEvent> tensionEvents,
    @JsonProperty("descents") List<DescentEvent> descents
) {
    public AssessmentReport {
        tensionEvents = List.copyOf(tensionEvents);
        descents = List.copyOf(descents);
    }
}
