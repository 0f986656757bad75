package com.climbassessment.common.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Anatomical landmarks tracked by the landmark buffer.
 *
 * <p>Wire names follow the pose provider's snake_case convention
 * ({@code left_wrist}, {@code right_ankle}, ...). Landmarks the provider emits
 * beyond this set (face, fingers) are ignored.
 */
public enum Joint {
    LEFT_SHOULDER("left_shoulder", Side.LEFT),
    RIGHT_SHOULDER("right_shoulder", Side.RIGHT),
    LEFT_ELBOW("left_elbow", Side.LEFT),
    RIGHT_ELBOW("right_elbow", Side.RIGHT),
    LEFT_WRIST("left_wrist", Side.LEFT),
    RIGHT_WRIST("right_wrist", Side.RIGHT),
    LEFT_HIP("left_hip", Side.LEFT),
    RIGHT_HIP("right_hip", Side.RIGHT),
    LEFT_KNEE("left_knee", Side.LEFT),
    RIGHT_KNEE("right_knee", Side.RIGHT),
    LEFT_ANKLE("left_ankle", Side.LEFT),
    RIGHT_ANKLE("right_ankle", Side.RIGHT),
    LEFT_HEEL("left_heel", Side.LEFT),
    RIGHT_HEEL("right_heel", Side.RIGHT),
    LEFT_FOOT_INDEX("left_foot_index", Side.LEFT),
    RIGHT_FOOT_INDEX("right_foot_index", Side.RIGHT);

    private static final Map<String, Joint> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Joint::wireName, Function.identity()));

    private final String wireName;
    private final Side side;

    Joint(String wireName, Side side) {
        this.wireName = wireName;
        this.side = side;
    }

    public String wireName() { return wireName; }

    public Side side() { return side; }

    public boolean isHand() { return this == LEFT_WRIST || this == RIGHT_WRIST; }

    public boolean isFoot() { return this == LEFT_ANKLE || this == RIGHT_ANKLE; }

    public static Optional<Joint> fromWireName(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    public static Joint wrist(Side side) {
        return side == Side.LEFT ? LEFT_WRIST : RIGHT_WRIST;
    }

    public static Joint ankle(Side side) {
        return side == Side.LEFT ? LEFT_ANKLE : RIGHT_ANKLE;
    }

    public static Joint shoulder(Side side) {
        return side == Side.LEFT ? LEFT_SHOULDER : RIGHT_SHOULDER;
    }

    public static Joint elbow(Side side) {
        return side == Side.LEFT ? LEFT_ELBOW : RIGHT_ELBOW;
    }

    public static Joint hip(Side side) {
        return side == Side.LEFT ? LEFT_HIP : RIGHT_HIP;
    }

    public static Joint knee(Side side) {
        return side == Side.LEFT ? LEFT_KNEE : RIGHT_KNEE;
    }
}
