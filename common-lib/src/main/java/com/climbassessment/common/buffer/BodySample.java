package com.climbassessment.common.buffer;

import com.climbassessment.common.kinematics.BodyGeometry;
import com.climbassessment.common.kinematics.PlanarPoint;
import com.climbassessment.common.model.Joint;

/**
 * Whole-body measurements of one accepted frame. The buffer records one per
 * frame for the whole session, independent of the joint ring's capacity.
 *
 * @param trunkAngle   trunk angle from the wall vertical in degrees; {@code NaN} when the trunk is not usable
 * @param armShare     share of body load on the arms in percent; {@code NaN} when a limb or hip is not usable
 * @param centerOfMass approximate centre of mass; {@code null} when the hips are not usable
 * @param leftHand     left wrist sample of the frame
 * @param rightHand    right wrist sample of the frame
 */
public record BodySample(
    long frameIndex,
    double timestamp,
    double trunkAngle,
    double armShare,
    PlanarPoint centerOfMass,
    JointSample leftHand,
    JointSample rightHand
) {
    static BodySample of(FrameSnapshot frame) {
        return new BodySample(frame.frameIndex(), frame.timestamp(),
            BodyGeometry.trunkAngle(frame),
            BodyGeometry.armLoadShare(frame),
            BodyGeometry.centerOfMass(frame).orElse(null),
            frame.get(Joint.LEFT_WRIST),
            frame.get(Joint.RIGHT_WRIST));
    }

    /**
     * @throws IllegalArgumentException if {@code hand} is not a wrist
     */
    public JointSample hand(Joint hand) {
        return switch (hand) {
            case LEFT_WRIST -> leftHand;
            case RIGHT_WRIST -> rightHand;
            default -> throw new IllegalArgumentException("not a hand: " + hand);
        };
    }
}
