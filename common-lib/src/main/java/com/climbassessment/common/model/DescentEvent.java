package com.climbassessment.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One downward centre-of-mass episode.
 *
 * @param start      timestamp of the last frame before the descent began
 * @param duration   seconds from {@code start} to the last descending frame
 * @param drop       vertical centre-of-mass drop in normalised image units
 * @param peakSpeed  fastest frame-to-frame downward speed, units per second
 * @param speedRatio peak over mean downward speed; 1 for a perfectly even descent
 * @param handGrab   a hand moved sharply upward relative to the body during the episode
 */
public record DescentEvent(
    @JsonProperty("kind") DescentKind kind,
    @JsonProperty("start") double start,
    @JsonProperty("duration") double duration,
    @JsonProperty("drop") double drop,
    @JsonProperty("peakSpeed") double peakSpeed,
    @JsonProperty("speedRatio") double speedRatio,
    @JsonProperty("handGrab") boolean handGrab
) {
    @JsonIgnore
    public boolean isFall() {
        return kind == DescentKind.FALL;
    }
}
