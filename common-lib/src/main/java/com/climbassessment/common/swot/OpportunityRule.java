package com.climbassessment.common.swot;

import com.climbassessment.common.model.MetricCategory;

import java.util.Map;
import java.util.Set;

/**
 * Improvement hint attached to a weakness of one category.
 *
 * <p>The rule only runs when every name in {@link #requiredInputs()} is
 * present in the weakness's raw mapping; otherwise the opportunity is skipped.
 */
public interface OpportunityRule {

    /** Rule id, also the key of the rule's text in the template set. */
    String id();

    MetricCategory category();

    Set<String> requiredInputs();

    /**
     * Derived values for rendering.
     *
     * @param inputs the weakness's raw mapping, containing at least the required inputs
     */
    Map<String, Double> calculate(Map<String, Double> inputs);
}
