package com.di.insightnova.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for scheduled jobs, inference gateway calls and the pipeline outcomes
 * (items, insights, alerts, recommendations, scaling decisions).
 * Meters with a variable tag are resolved through the registry, which caches them by id.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // Inference Gateway Metrics
    private final Timer gatewayTimer;
    private final Counter gatewaySuccessCounter;
    private final Counter gatewayErrorCounter;

    // Insight / Recommendation Metrics
    private final Counter insightsCounter;
    private final Counter recommendationsCounter;
    private final DistributionSummary insightConfidence;

    // Notification Metrics
    private final Counter notificationsSentCounter;
    private final Counter notificationsRejectedCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.gatewayTimer = Timer.builder("insightnova.gateway.duration")
                .description("Time taken by inference gateway calls")
                .register(meterRegistry);

        this.gatewaySuccessCounter = Counter.builder("insightnova.gateway.calls")
                .description("Total number of inference gateway calls")
                .tag("status", "success")
                .register(meterRegistry);

        this.gatewayErrorCounter = Counter.builder("insightnova.gateway.calls")
                .description("Total number of failed inference gateway calls")
                .tag("status", "error")
                .register(meterRegistry);

        this.insightsCounter = Counter.builder("insightnova.insights.created")
                .description("Stream insights persisted")
                .register(meterRegistry);

        this.recommendationsCounter = Counter.builder("insightnova.recommendations.created")
                .description("Recommendations persisted")
                .register(meterRegistry);

        this.insightConfidence = DistributionSummary.builder("insightnova.insights.confidence")
                .description("Distribution of insight confidence")
                .register(meterRegistry);

        this.notificationsSentCounter = Counter.builder("insightnova.notifications")
                .tag("status", "sent")
                .register(meterRegistry);

        this.notificationsRejectedCounter = Counter.builder("insightnova.notifications")
                .tag("status", "rejected")
                .register(meterRegistry);
    }

    // ============================================================================
    // Job Metrics
    // ============================================================================

    /**
     * Records a finished job run.
     *
     * @param jobName    job name, used as the {@code job} tag
     * @param durationMs wall time of the run
     * @param success    false when the run threw or timed out
     */
    public void recordJobRun(String jobName, long durationMs, boolean success) {
        Timer.builder("insightnova.job.duration")
                .description("Scheduled job duration")
                .tag("job", jobName)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        Counter.builder("insightnova.job.runs")
                .tag("job", jobName)
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        log.debug("Recorded job run: job={}, durationMs={}, success={}", jobName, durationMs, success);
    }

    public void recordJobTimeout(String jobName) {
        Counter.builder("insightnova.job.timeouts").tag("job", jobName).register(meterRegistry).increment();
    }

    public void recordJobSkipped(String jobName) {
        Counter.builder("insightnova.job.skipped").tag("job", jobName).register(meterRegistry).increment();
    }

    // ============================================================================
    // Inference Gateway Metrics
    // ============================================================================

    public void recordGatewayCall(String operation, long durationMs, boolean success) {
        gatewayTimer.record(durationMs, TimeUnit.MILLISECONDS);
        if (success) {
            gatewaySuccessCounter.increment();
        } else {
            gatewayErrorCounter.increment();
        }
        log.debug("Recorded gateway call: op={}, durationMs={}, success={}", operation, durationMs, success);
    }

    // ============================================================================
    // Pipeline Outcome Metrics
    // ============================================================================

    /**
     * Records what happened to a staged item at a stage (valid, invalid, retrying, needs_review, published).
     */
    public void recordItemOutcome(String stage, String outcome) {
        Counter.builder("insightnova.pipeline.items")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordInsight(double confidence) {
        insightsCounter.increment();
        insightConfidence.record(confidence);
    }

    public void recordAlertCreated(String sourceType, String urgency) {
        Counter.builder("insightnova.alerts.created")
                .tag("source", sourceType)
                .tag("urgency", urgency)
                .register(meterRegistry)
                .increment();
    }

    public void recordNotification(boolean sent) {
        if (sent) {
            notificationsSentCounter.increment();
        } else {
            notificationsRejectedCounter.increment();
        }
    }

    public void recordRecommendations(int count) {
        recommendationsCounter.increment(count);
    }

    public void recordScalingDecision(String resourceType, String action, boolean executed) {
        Counter.builder("insightnova.scaling.decisions")
                .tag("resource", resourceType)
                .tag("action", action)
                .tag("executed", String.valueOf(executed))
                .register(meterRegistry)
                .increment();
    }

    public void recordRegression(String severity) {
        Counter.builder("insightnova.performance.regressions")
                .tag("severity", severity)
                .register(meterRegistry)
                .increment();
    }

    // ============================================================================
    // Utility Methods
    // ============================================================================

    /**
     * Creates a timer sample for manual timing.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }
}
