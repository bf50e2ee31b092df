package com.di.insightnova.scheduler;

import com.di.insightnova.alert.AlertService;
import com.di.insightnova.insight.StreamProcessor;
import com.di.insightnova.maintenance.RetentionService;
import com.di.insightnova.performance.BaselineService;
import com.di.insightnova.pipeline.PipelineProcessor;
import com.di.insightnova.recommendation.RecommendationService;
import com.di.insightnova.scaling.ScalingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic jobs. Each tick only dispatches to {@link JobRunner}, which owns timeouts, overlap
 * protection and job metrics. Disable all of them with {@code insightnova.scheduler.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "insightnova.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledJobs {

    public static final String PIPELINE = "pipeline";
    public static final String STREAM = "stream";
    public static final String ALERTS = "alerts";
    public static final String RECOMMENDATIONS = "recommendations";
    public static final String SCALING = "scaling";
    public static final String BASELINE = "baseline";
    public static final String REGRESSION_SWEEP = "regression_sweep";
    public static final String MAINTENANCE = "maintenance";

    private final JobRunner jobRunner;
    private final PipelineProcessor pipelineProcessor;
    private final StreamProcessor streamProcessor;
    private final AlertService alertService;
    private final RecommendationService recommendationService;
    private final ScalingService scalingService;
    private final BaselineService baselineService;
    private final RetentionService retentionService;

    @Scheduled(fixedDelayString = "${insightnova.scheduler.pipeline-delay-ms:180000}",
            initialDelayString = "${insightnova.scheduler.initial-delay-ms:30000}")
    public void pipeline() {
        jobRunner.run(PIPELINE, pipelineProcessor::processBatch);
    }

    @Scheduled(fixedDelayString = "${insightnova.scheduler.stream-delay-ms:300000}",
            initialDelayString = "${insightnova.scheduler.initial-delay-ms:30000}")
    public void stream() {
        jobRunner.run(STREAM, streamProcessor::processPendingStreams);
    }

    /** Insight triggers, then the workload anomaly check, then notification dispatch. */
    @Scheduled(fixedDelayString = "${insightnova.scheduler.alerts-delay-ms:120000}",
            initialDelayString = "${insightnova.scheduler.initial-delay-ms:30000}")
    public void alerts() {
        jobRunner.run(ALERTS, () -> {
            int created = alertService.processAlertTriggers();
            if (alertService.detectWorkloadAnomalies()) {
                created++;
            }
            int sent = alertService.dispatchNotifications();
            return "created=" + created + ", sent=" + sent;
        });
    }

    @Scheduled(fixedDelayString = "${insightnova.scheduler.recommendations-delay-ms:600000}",
            initialDelayString = "${insightnova.scheduler.initial-delay-ms:30000}")
    public void recommendations() {
        jobRunner.run(RECOMMENDATIONS, recommendationService::refreshActiveUsers);
    }

    @Scheduled(fixedDelayString = "${insightnova.scheduler.scaling-delay-ms:300000}",
            initialDelayString = "${insightnova.scheduler.initial-delay-ms:30000}")
    public void scaling() {
        jobRunner.run(SCALING, scalingService::runScalingCycle);
    }

    @Scheduled(cron = "${insightnova.scheduler.baseline-cron:0 15 2 * * *}", zone = "UTC")
    public void baseline() {
        jobRunner.run(BASELINE, baselineService::refreshBaselines);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void baselineOnStartup() {
        log.info("[JOB] Computing performance baselines on startup");
        baseline();
    }

    @Scheduled(fixedDelayString = "${insightnova.scheduler.regression-sweep-delay-ms:3600000}",
            initialDelayString = "${insightnova.scheduler.regression-sweep-initial-delay-ms:600000}")
    public void regressionSweep() {
        jobRunner.run(REGRESSION_SWEEP, () -> baselineService.runRegressionSweep().size());
    }

    @Scheduled(fixedDelayString = "${insightnova.scheduler.maintenance-delay-ms:3600000}",
            initialDelayString = "${insightnova.scheduler.maintenance-initial-delay-ms:300000}")
    public void maintenance() {
        jobRunner.run(MAINTENANCE, retentionService::purge);
    }
}
