package com.di.insightnova.performance;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code insightnova.performance.*}.
 */
@Data
@ConfigurationProperties(prefix = "insightnova.performance")
public class PerformanceProperties {

    /** Trailing window the baselines are computed over. */
    private int windowDays = 7;
    /** Window whose mean is checked against the baseline in each sweep. */
    private Duration sweepWindow = Duration.ofHours(1);
    private double lowerPercentile = 0.10;
    private double upperPercentile = 0.90;
    /** Cap on samples held by the in-memory store; the oldest are evicted first. */
    private int maxInMemorySamples = 100_000;
}
