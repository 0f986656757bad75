package com.climbassessment.common.buffer;

public enum MotionEventKind {
    /** A limb started moving after being at rest. */
    MOVE,
    /** A limb came to rest for at least the settle dwell. */
    SETTLE,
    /** A hand exceeded the dynamic-move velocity. */
    DYNAMIC,
    /** Whole-body stillness after the first move, at least the pause minimum long. */
    PAUSE,
    /** The first limb movement of the session. */
    FIRST_MOVE
}
