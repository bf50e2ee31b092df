package com.di.insightnova.performance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest detected regression for a (component, metric), kept for health reporting and
 * scaling rationale.
 */
@Value
@Builder
public class RegressionFinding {
    String component;
    String metric;
    double value;
    RegressionSeverity severity;
    double degradationPct;
    String recommendation;
    Instant detectedAt;

    public String describe() {
        return String.format(java.util.Locale.ROOT, "%s/%s %s (+%.1f%%)",
                component, metric, severity, degradationPct);
    }
}
