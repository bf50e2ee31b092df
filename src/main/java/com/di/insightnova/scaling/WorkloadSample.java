package com.di.insightnova.scaling;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One workload observation plus the forecast made at sampling time. Append-only.
 */
@Value
@Builder
public class WorkloadSample {
    String id;
    Instant sampledAt;
    long pendingItems;
    long activeTasks;
    double gatewayCallsPerMinute;
    double averageGatewayLatencyMs;
    /** Backlog relative to configured capacity, 0–100. */
    double systemLoadPct;
    /** Forecast load for the next step; null when {@link #forecastAvailable} is false. */
    Double predictedLoad;
    Double forecastLower;
    Double forecastUpper;
    boolean forecastAvailable;
}
