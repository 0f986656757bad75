package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SwotReport(
    @JsonProperty("strengths") List<SwotItem> strengths,
    @JsonProperty("weaknesses") List<SwotItem> weaknesses,
    @JsonProperty("opportunities") List<SwotItem> opportunities,
    @JsonProperty("threats") List<SwotItem> threats
) {
    public SwotReport {
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        opportunities = List.copyOf(opportunities);
        threats = List.copyOf(threats);
    }
}
