package com.climbassessment.common.swot;

/**
 * Caps and cut-offs of SWOT synthesis.
 *
 * @param weaknessCutoff scores strictly below this are weaknesses
 */
public record SwotLimits(
    int maxStrengths,
    int maxWeaknesses,
    int maxOpportunities,
    int maxThreats,
    double weaknessCutoff
) {
    public static SwotLimits defaults() {
        return new SwotLimits(4, 4, 3, 3, 55.0);
    }
}
