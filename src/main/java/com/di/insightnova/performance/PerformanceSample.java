package com.di.insightnova.performance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observation of a component metric, e.g. {@code inference_gateway/latency_ms} or
 * {@code pipeline/duration_ms}.
 */
@Value
@Builder
public class PerformanceSample {
    String component;
    String metric;
    double value;
    Instant recordedAt;
}
