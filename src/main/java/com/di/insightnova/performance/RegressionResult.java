package com.di.insightnova.performance;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of checking one value against its baseline. {@code baseline} is null when none exists.
 */
@Value
@Builder
public class RegressionResult {
    String component;
    String metric;
    double value;
    boolean detected;
    RegressionSeverity severity;
    PerformanceBaseline baseline;
    /** Percent above the baseline mean; 0 without a baseline. */
    double degradationPct;
    String recommendation;
}
