package com.climbassessment.common.swot;

import java.util.Optional;

/**
 * Injury-risk condition evaluated independently of the per-category pipeline.
 */
public interface ThreatRule {

    /** Rule id, also the key of the rule's entry in the template set. */
    String id();

    /** Threshold used when the template set does not override it. */
    double defaultThreshold();

    Optional<ThreatFinding> evaluate(ThreatInputs inputs, double threshold);
}
