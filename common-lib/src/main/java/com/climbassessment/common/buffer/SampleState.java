package com.climbassessment.common.buffer;

/**
 * How a buffered sample came to be.
 *
 * <ul>
 *   <li>{@link #OBSERVED}: landmark present, physical and above the joint's confidence floor</li>
 *   <li>{@link #HELD}:     previous valid position carried forward (hold-last-value)</li>
 *   <li>{@link #LOST}:     hold expired; position unknown for this frame</li>
 * </ul>
 */
public enum SampleState {
    OBSERVED,
    HELD,
    LOST
}
