package com.di.insightnova.health;

import com.di.insightnova.alert.AlertStore;
import com.di.insightnova.alert.NotificationStatus;
import com.di.insightnova.insight.InsightStore;
import com.di.insightnova.insight.Urgency;
import com.di.insightnova.performance.BaselineService;
import com.di.insightnova.performance.RegressionFinding;
import com.di.insightnova.performance.RegressionSeverity;
import com.di.insightnova.pipeline.staging.StagingStore;
import com.di.insightnova.pipeline.staging.ValidationStatus;
import com.di.insightnova.pipeline.task.TaskStatus;
import com.di.insightnova.pipeline.task.TaskTracker;
import com.di.insightnova.stream.StreamEventStatus;
import com.di.insightnova.stream.StreamEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Pipeline and system health snapshots for the health API.
 *
 * <p>System status is {@code unhealthy} above 1000 pending stream events or 50 pending
 * notifications, {@code degraded} above 500 / 20 or with any SEVERE regression, else
 * {@code healthy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration ALERT_WINDOW = Duration.ofHours(24);

    private final StagingStore stagingStore;
    private final StreamEventStore streamEventStore;
    private final TaskTracker taskTracker;
    private final AlertStore alertStore;
    private final InsightStore insightStore;
    private final BaselineService baselineService;
    private final Clock clock;

    public PipelineHealth pipelineHealth() {
        Instant now = clock.instant();
        Instant since = now.minus(HOUR);
        long pending = stagingStore.countByStatus(ValidationStatus.PENDING);
        long valid = stagingStore.countByStatusSince(ValidationStatus.VALID, since);
        long invalid = stagingStore.countByStatusSince(ValidationStatus.INVALID, since);
        long review = stagingStore.countByStatusSince(ValidationStatus.NEEDS_REVIEW, since);
        long processed = valid + invalid + review;
        long retrying = taskTracker.counts().getOrDefault(TaskStatus.RETRYING, 0L);

        return PipelineHealth.builder()
                .pending(pending)
                .throughputPerHour(processed)
                .errorRate(processed == 0 ? 0.0 : (double) (invalid + review) / processed)
                .avgLatencySeconds(taskTracker.averageCompletionSeconds(since))
                .backlog(pending + streamEventStore.countByStatus(StreamEventStatus.PENDING) + retrying)
                .checkedAt(now)
                .build();
    }

    public SystemHealth systemHealth() {
        Instant now = clock.instant();
        long pendingEvents = streamEventStore.countByStatus(StreamEventStatus.PENDING);
        long pendingNotifications = alertStore.countByStatus(NotificationStatus.PENDING);
        long activeAlerts = alertStore.countActiveSince(now.minus(ALERT_WINDOW), EnumSet.of(Urgency.HIGH, Urgency.CRITICAL));
        List<RegressionFinding> regressions = baselineService.currentFindings();

        String status = status(pendingEvents, pendingNotifications, regressions);
        if (!HEALTHY.equals(status)) {
            log.warn("[HEALTH] System {}: pendingEvents={}, pendingNotifications={}, regressions={}",
                    status, pendingEvents, pendingNotifications, regressions.size());
        }
        return SystemHealth.builder()
                .status(status)
                .activeAlerts(activeAlerts)
                .pendingStreamEvents(pendingEvents)
                .pendingNotifications(pendingNotifications)
                .insightsLastHour(insightStore.countCreatedSince(now.minus(HOUR)))
                .performanceScore(performanceScore(regressions))
                .regressions(regressions)
                .checkedAt(now)
                .build();
    }

    static String status(long pendingEvents, long pendingNotifications, List<RegressionFinding> regressions) {
        if (pendingEvents > 1000 || pendingNotifications > 50) {
            return UNHEALTHY;
        }
        boolean severe = regressions.stream().anyMatch(r -> r.getSeverity() == RegressionSeverity.SEVERE);
        if (pendingEvents > 500 || pendingNotifications > 20 || severe) {
            return DEGRADED;
        }
        return HEALTHY;
    }

    static double performanceScore(List<RegressionFinding> regressions) {
        double score = 100.0;
        for (RegressionFinding r : regressions) {
            switch (r.getSeverity()) {
                case SEVERE:
                    score -= 30;
                    break;
                case MODERATE:
                    score -= 15;
                    break;
                case MINOR:
                    score -= 5;
                    break;
                default:
                    break;
            }
        }
        return Math.max(0.0, score);
    }
}
