package com.climbassessment.common.swot;

import com.climbassessment.common.model.DescentEvent;
import com.climbassessment.common.model.TechniqueProfile;
import com.climbassessment.common.model.TensionEvent;

import java.util.List;

/** Everything a threat rule may read: the session's tension events, its descents and its scored profile. */
public record ThreatInputs(List<TensionEvent> tensionEvents, List<DescentEvent> descents, TechniqueProfile profile) {

    public ThreatInputs {
        tensionEvents = List.copyOf(tensionEvents);
        descents = List.copyOf(descents);
    }
}
