package com.di.insightnova.scaling;

import lombok.Builder;
import lombok.Value;

/**
 * What the controller did with one policy in one cycle.
 */
@Value
@Builder
public class ScalingOutcome {

    public enum Status {
        EXECUTED,
        /** Scale-up whose ROI was below the minimum; recorded, not applied. */
        RECOMMENDED_ONLY,
        COOLDOWN,
        MAINTAINED,
        /** Lost the compare-and-set to a concurrent writer. */
        CONFLICT
    }

    ResourceType resourceType;
    ScalingAction action;
    Status status;
    int fromCapacity;
    int toCapacity;
    CostBenefit costBenefit;
}
