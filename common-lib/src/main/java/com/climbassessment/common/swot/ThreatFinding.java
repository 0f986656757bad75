package com.climbassessment.common.swot;

import com.climbassessment.common.model.Side;

import java.util.Map;

/**
 * A fired threat rule before rendering.
 *
 * @param severity ordering key among threats (count or extremum)
 * @param side     attributed side; {@code NONE} for ties and unsided regions
 * @param values   numeric placeholder values
 */
public record ThreatFinding(String ruleId, double severity, Side side, Map<String, Double> values) {

    public ThreatFinding {
        values = Map.copyOf(values);
    }
}
