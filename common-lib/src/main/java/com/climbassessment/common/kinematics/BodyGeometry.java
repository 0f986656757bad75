package com.climbassessment.common.kinematics;

import com.climbassessment.common.buffer.FrameSnapshot;
import com.climbassessment.common.buffer.JointSample;
import com.climbassessment.common.model.Joint;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Whole-body reference points derived from one frame snapshot.
 */
public final class BodyGeometry {

    private static final double ARM_FACTOR = 1.5;
    private static final double LEG_FACTOR = 1.2;

    private static final Joint[] TRUNK = {
        Joint.LEFT_HIP, Joint.RIGHT_HIP, Joint.LEFT_SHOULDER, Joint.RIGHT_SHOULDER
    };

    private static final Joint[] LIMBS_AND_HIPS = {
        Joint.LEFT_WRIST, Joint.RIGHT_WRIST, Joint.LEFT_ANKLE, Joint.RIGHT_ANKLE,
        Joint.LEFT_HIP, Joint.RIGHT_HIP
    };

    /** Segment weights of the approximate centre of mass. */
    private static final Map<Joint, Double> COM_WEIGHTS = new EnumMap<>(Joint.class);

    static {
        COM_WEIGHTS.put(Joint.LEFT_SHOULDER, 0.1);
        COM_WEIGHTS.put(Joint.RIGHT_SHOULDER, 0.1);
        COM_WEIGHTS.put(Joint.LEFT_HIP, 0.2);
        COM_WEIGHTS.put(Joint.RIGHT_HIP, 0.2);
        COM_WEIGHTS.put(Joint.LEFT_KNEE, 0.1);
        COM_WEIGHTS.put(Joint.RIGHT_KNEE, 0.1);
        COM_WEIGHTS.put(Joint.LEFT_ANKLE, 0.1);
        COM_WEIGHTS.put(Joint.RIGHT_ANKLE, 0.1);
    }

    private BodyGeometry() { /* utility class */ }

    /**
     * Weighted centre of the usable trunk and leg joints. Both hips must be
     * usable; other missing joints are dropped and the weights renormalised.
     */
    public static Optional<PlanarPoint> centerOfMass(FrameSnapshot frame) {
        if (!frame.usable(Joint.LEFT_HIP, Joint.RIGHT_HIP)) {
            return Optional.empty();
        }
        double x = 0, y = 0, total = 0;
        for (Map.Entry<Joint, Double> entry : COM_WEIGHTS.entrySet()) {
            JointSample sample = frame.get(entry.getKey());
            if (sample == null || !sample.isUsable()) continue;
            x += sample.x() * entry.getValue();
            y += sample.y() * entry.getValue();
            total += entry.getValue();
        }
        return Optional.of(new PlanarPoint(x / total, y / total));
    }

    public static Optional<PlanarPoint> midpoint(FrameSnapshot frame, Joint a, Joint b) {
        if (!frame.usable(a, b)) {
            return Optional.empty();
        }
        JointSample first = frame.get(a);
        JointSample second = frame.get(b);
        return Optional.of(new PlanarPoint((first.x() + second.x()) / 2.0, (first.y() + second.y()) / 2.0));
    }

    public static Optional<PlanarPoint> hipCenter(FrameSnapshot frame) {
        return midpoint(frame, Joint.LEFT_HIP, Joint.RIGHT_HIP);
    }

    public static Optional<PlanarPoint> shoulderCenter(FrameSnapshot frame) {
        return midpoint(frame, Joint.LEFT_SHOULDER, Joint.RIGHT_SHOULDER);
    }

    /**
     * Angle in degrees between the hip-centre to shoulder-centre vector and the
     * wall vertical. Depth is used only when all four trunk joints carry it.
     * {@code NaN} when a trunk joint is not usable or the trunk has no length.
     */
    public static double trunkAngle(FrameSnapshot frame) {
        if (!frame.usable(TRUNK)) {
            return Double.NaN;
        }
        JointSample lh = frame.get(Joint.LEFT_HIP);
        JointSample rh = frame.get(Joint.RIGHT_HIP);
        JointSample ls = frame.get(Joint.LEFT_SHOULDER);
        JointSample rs = frame.get(Joint.RIGHT_SHOULDER);

        double dx = (ls.x() + rs.x()) / 2.0 - (lh.x() + rh.x()) / 2.0;
        double dy = (ls.y() + rs.y()) / 2.0 - (lh.y() + rh.y()) / 2.0;
        double dz = 0.0;
        if (lh.hasDepth() && rh.hasDepth() && ls.hasDepth() && rs.hasDepth()) {
            dz = (ls.z() + rs.z()) / 2.0 - (lh.z() + rh.z()) / 2.0;
        }
        double length = Math.sqrt(dx * dx + dy * dy + dz * dz);
        if (length == 0) return Double.NaN;
        // wall-plane vertical points up the image: (0, -1, 0)
        double cosine = -dy / length;
        return Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, cosine))));
    }

    /**
     * Share of body load on the arms in percent, from how far each hand sits
     * above and each foot below the hip centre. Arms are weighted 1.5, legs 1.2.
     * {@code NaN} when a limb or hip is not usable or every limb is level with the hips.
     */
    public static double armLoadShare(FrameSnapshot frame) {
        if (!frame.usable(LIMBS_AND_HIPS)) {
            return Double.NaN;
        }
        double hipY = (frame.get(Joint.LEFT_HIP).y() + frame.get(Joint.RIGHT_HIP).y()) / 2.0;
        double arms = ARM_FACTOR * (Math.abs(hipY - frame.get(Joint.LEFT_WRIST).y())
            + Math.abs(hipY - frame.get(Joint.RIGHT_WRIST).y()));
        double legs = LEG_FACTOR * (Math.abs(frame.get(Joint.LEFT_ANKLE).y() - hipY)
            + Math.abs(frame.get(Joint.RIGHT_ANKLE).y() - hipY));
        double total = arms + legs;
        return total > 0 ? arms / total * 100.0 : Double.NaN;
    }
}
