package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session-level tally of threshold crossings for one region, kind and side.
 *
 * @param count    number of rising-edge threshold crossings
 * @param extremum most extreme value observed while over the threshold
 */
public record TensionEvent(
    @JsonProperty("region") BodyRegion region,
    @JsonProperty("kind") TensionKind kind,
    @JsonProperty("side") Side side,
    @JsonProperty("count") int count,
    @JsonProperty("extremum") double extremum
) {}
