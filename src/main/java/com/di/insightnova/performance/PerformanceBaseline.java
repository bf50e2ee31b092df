package com.di.insightnova.performance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Expected range of a (component, metric) over the trailing window: mean, p10 as the lower band
 * and p90 as the upper band.
 */
@Value
@Builder
public class PerformanceBaseline {
    String component;
    String metric;
    double mean;
    double lowerBand;
    double upperBand;
    int windowDays;
    int sampleCount;
    Instant updatedAt;

    public String key() {
        return component + "/" + metric;
    }
}
