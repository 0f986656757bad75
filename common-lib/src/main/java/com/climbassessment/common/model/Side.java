package com.climbassessment.common.model;

/**
 * Body side a landmark or tension event is attributed to.
 * {@link #NONE} covers midline structures and ties between sides.
 */
public enum Side {
    LEFT,
    RIGHT,
    NONE;

    public Side opposite() {
        return switch (this) {
            case LEFT  -> RIGHT;
            case RIGHT -> LEFT;
            case NONE  -> NONE;
        };
    }
}
