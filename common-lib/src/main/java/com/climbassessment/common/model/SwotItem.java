package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One rendered SWOT line.
 *
 * @param source metric id or rule id the line was produced from
 * @param value  category score for strengths/weaknesses/opportunities, severity for threats
 * @param text   rendered text
 */
public record SwotItem(
    @JsonProperty("source") String source,
    @JsonProperty("value") double value,
    @JsonProperty("text") String text
) {}
