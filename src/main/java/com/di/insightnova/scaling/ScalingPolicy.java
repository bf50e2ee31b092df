package com.di.insightnova.scaling;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Scaling rules and current capacity of one resource. {@code version} increases on every write;
 * writers compare-and-set against the version they read.
 */
@Value
@Builder(toBuilder = true)
public class ScalingPolicy {
    ResourceType resourceType;
    int minCapacity;
    int maxCapacity;
    int currentCapacity;
    /** Load percentage above which the resource scales up. */
    double scaleUpThreshold;
    /** Load percentage below which the resource scales down. */
    double scaleDownThreshold;
    int scaleUpIncrement;
    int scaleDownIncrement;
    Duration cooldown;
    double unitCost;
    Instant lastActionAt;
    boolean active;
    ScalingState lastState;
    long version;

    public boolean isCoolingDown(Instant now) {
        return lastActionAt != null && Duration.between(lastActionAt, now).compareTo(cooldown) < 0;
    }
}
