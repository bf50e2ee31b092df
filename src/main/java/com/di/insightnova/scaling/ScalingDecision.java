package com.di.insightnova.scaling;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScalingDecision {
    ResourceType resourceType;
    ScalingAction action;
    int currentCapacity;
    int targetCapacity;
    double load;
    /** Forecast the decision used; null when it fell back to current load only. */
    Double forecast;
    double upThreshold;
    double downThreshold;
    String rationale;

    public boolean changesCapacity() {
        return action != ScalingAction.MAINTAIN && targetCapacity != currentCapacity;
    }
}
