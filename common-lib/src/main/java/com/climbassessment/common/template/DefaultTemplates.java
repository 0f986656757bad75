package com.climbassessment.common.template;

import com.climbassessment.common.model.Level;
import com.climbassessment.common.model.MetricCategory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled-in template set. Used whole when no template document is
 * available, and entry by entry when a document entry fails validation.
 */
public final class DefaultTemplates {

    private static final TemplateSet INSTANCE = build();

    private DefaultTemplates() { /* utility class */ }

    public static TemplateSet get() {
        return INSTANCE;
    }

    public static MetricTemplates metric(MetricCategory category) {
        return INSTANCE.metrics().get(category);
    }

    public static String opportunity(String ruleId) {
        return INSTANCE.opportunities().get(ruleId);
    }

    public static ThreatTemplate threat(String ruleId) {
        return INSTANCE.threats().get(ruleId);
    }

    private static TemplateSet build() {
        Map<MetricCategory, MetricTemplates> metrics = new EnumMap<>(MetricCategory.class);

        metrics.put(MetricCategory.QUIET_FEET, generic(
            "Precise feet {score}%: each foot goes straight to the right spot, saving energy.",
            "Footwork {score}%: few repositions, which saves strength.",
            "Foot repositioning {score}%: {repositions} adjustments per hold instead of {norm}. It eats energy.",
            "Feet are searching for holds at {score}%: {repositions} adjustments instead of {norm}. Critical for progress."));

        metrics.put(MetricCategory.HIP_POSITION, generic(
            "Hip position {score}%: weight on the feet, arms resting. Excellent technique.",
            "Hip position {score}%: a slight lean, but good overall.",
            "Hips off line at {score}% ({angle}°). Arms carry an extra {overload}% of the load.",
            "Hips far from the wall at {score}% ({angle}°). Arms overloaded by {overload}%. Your main growth area."));

        metrics.put(MetricCategory.DIAGONAL, generic(
            "Counterbalance {score}%: excellent diagonal movement, stable balance.",
            "Counterbalance {score}%: diagonals are working, balance is good.",
            "Counterbalance {score}%: moves are square and the body swings.",
            "No diagonal at {score}%: chaotic movement, a lot of energy spent stabilising."));

        metrics.put(MetricCategory.ROUTE_READING, generic(
            "Route reading {score}%: you plan the route and take pauses. A sign of an experienced climber.",
            "Route reading {score}%: there is planning, you do not climb blind.",
            "Route reading {score}%: few pauses to look ahead ({pauses} pauses). Add planning.",
            "Impulsive climbing at {score}%: you jump on the route after {preview}s without a plan."));

        metrics.put(MetricCategory.RHYTHM, generic(
            "Rhythm {score}%: even movement, full control.",
            "Rhythm {score}%: steady pace with small fluctuations.",
            "Rhythm {score}%: the pace breaks on hard sections. Spread ±{variance}ms.",
            "Ragged rhythm at {score}%. Spread ±{variance}ms. A sign of stress or panic."));

        metrics.put(MetricCategory.DYNAMIC_CONTROL, generic(
            "Dynamic control {score}%: you stabilise right after dynamic moves.",
            "Dynamic control {score}%: dynamic moves are under control.",
            "Dynamic control {score}%: after dynamic moves you take {time}s to find balance.",
            "Losing control after dynamic moves at {score}%. Stabilising takes {time}s instead of 0.5s."));

        metrics.put(MetricCategory.GRIP_RELEASE, generic(
            "Hand transitions {score}%: smooth, soft movement that saves energy.",
            "Hand transitions {score}%: reasonably smooth arm movement.",
            "Hand transitions {score}%: jerky releases cost you balance.",
            "Sharp hand transitions at {score}%. You yank holds and lose balance and energy."));

        Map<Level, LevelTexts> exhaustion = new EnumMap<>(Level.class);
        exhaustion.put(Level.LOW, LevelTexts.strength("Endurance {score}%: movement quality held to the top of the route."));
        exhaustion.put(Level.MODERATE, LevelTexts.weakness("Fatigue {percent}%: noticeable loss of quality towards the finish."));
        exhaustion.put(Level.HIGH, LevelTexts.weakness("Fatigue {percent}%: the last part of the route is climbed on reserves."));
        exhaustion.put(Level.CRITICAL, LevelTexts.weakness("Exhaustion {percent}%: the final section is in the red zone."));
        metrics.put(MetricCategory.EXHAUSTION, new MetricTemplates(exhaustion));

        Map<Level, LevelTexts> armLoad = new EnumMap<>(Level.class);
        armLoad.put(Level.OPTIMAL, LevelTexts.strength("Load distribution {score}%: legs carry {leg_load}% of the weight, arms stay fresh."));
        armLoad.put(Level.ACCEPTABLE, LevelTexts.strength("Load distribution {score}%: arms carry {arm_load}%, within a workable range."));
        armLoad.put(Level.OVERLOADED, LevelTexts.weakness("Arms overloaded: {arm_load}% instead of 30-40%. Shift the weight to your feet."));
        armLoad.put(Level.CRITICAL, LevelTexts.weakness("Arms at {arm_load}%: critical overload. Technique needs work."));
        metrics.put(MetricCategory.ARM_LOAD, new MetricTemplates(armLoad));

        Map<String, String> opportunities = new LinkedHashMap<>();
        opportunities.put("hip_position",
            "Bring your hip position up to {target}% and your arms will tire {reduction}% less.");
        opportunities.put("quiet_feet",
            "Precise footwork removes {saved} extra moves per route, saving {energy}% energy.");
        opportunities.put("diagonal",
            "Moving diagonally on {target}% of moves instead of {diagonal}% steadies your balance.");
        opportunities.put("route_reading",
            "Read the route for {target}s before starting instead of {preview}s and plan your rests.");
        opportunities.put("rhythm",
            "An even rhythm cuts energy use by {saved}% and takes the panic out of hard sections.");
        opportunities.put("dynamic_control",
            "Settling within {target}s after a dynamic move instead of {time}s keeps the next move on balance.");
        opportunities.put("grip_release",
            "Smooth hand transitions are worth a full grade. Right now they are your ceiling.");
        opportunities.put("arm_load",
            "Your legs carry only {leg_load}% of the weight. Getting that to {target}% opens up overhangs.");

        Map<String, ThreatTemplate> threats = new LinkedHashMap<>();
        threats.put("shoulder", ThreatTemplate.of(
            "Shoulder ({side}): locked {count} times on the route. Impingement risk if the pattern persists."));
        threats.put("elbow", ThreatTemplate.of(
            "Elbow ({side}): {count} acute angles below 70° under load (minimum {angle}°). Risk of climber's elbow."));
        threats.put("knee_rotation", ThreatTemplate.of(
            "Knee ({side}): rotated under load {count} times. Meniscus injury risk."));
        threats.put("lower_back", ThreatTemplate.of(
            "Lower back: twisted {angle}° under load. Disc protrusion risk if the pattern becomes chronic."));
        threats.put("exhaustion_critical", ThreatTemplate.of(
            "Exhaustion {percent}%: the final section is in the red zone. Loss of control means a fall risk."));
        threats.put("fall", ThreatTemplate.of(
            "Uncontrolled fall at {time}s: the body dropped {drop}% of the frame height. Check the landing zone and practise falling."));

        return new TemplateSet(metrics, opportunities, threats);
    }

    private static MetricTemplates generic(String excellent, String good, String medium, String poor) {
        Map<Level, LevelTexts> levels = new EnumMap<>(Level.class);
        levels.put(Level.EXCELLENT, LevelTexts.strength(excellent));
        levels.put(Level.GOOD, LevelTexts.strength(good));
        levels.put(Level.MEDIUM, LevelTexts.weakness(medium));
        levels.put(Level.POOR, LevelTexts.weakness(poor));
        return new MetricTemplates(levels);
    }
}
