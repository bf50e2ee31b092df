package com.di.insightnova.scaling;

import lombok.Data;

/**
 * Body of {@code PUT /api/scaling/policies/{type}}. Null fields keep the stored value; creating a
 * policy for a resource type with none stored needs every capacity and threshold field.
 */
@Data
public class PolicyUpdateRequest {
    private Integer minCapacity;
    private Integer maxCapacity;
    private Integer currentCapacity;
    private Double  scaleUpThreshold;
    private Double  scaleDownThreshold;
    private Integer scaleUpIncrement;
    private Integer scaleDownIncrement;
    private Long    cooldownSeconds;
    private Double  unitCost;
    private Boolean active;
}
