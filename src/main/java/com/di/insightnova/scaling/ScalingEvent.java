package com.di.insightnova.scaling;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record of an executed scaling decision, or of a scale-up that was only recommended
 * ({@code executed=false}).
 */
@Value
@Builder
public class ScalingEvent {
    String id;
    ResourceType resourceType;
    ScalingAction action;
    int fromCapacity;
    int toCapacity;
    double load;
    Double forecast;
    double roi;
    CostRecommendation recommendation;
    String rationale;
    boolean executed;
    Instant occurredAt;
}
