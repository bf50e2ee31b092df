package com.di.insightnova.alert;

import com.di.insightnova.ai.gateway.InferenceUnavailableException;
import com.di.insightnova.ai.gateway.SeriesPoint;
import com.di.insightnova.aspect.LogJob;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.exception.IllegalStatusTransitionException;
import com.di.insightnova.exception.ResourceNotFoundException;
import com.di.insightnova.insight.InsightStore;
import com.di.insightnova.insight.StreamInsight;
import com.di.insightnova.insight.Urgency;
import com.di.insightnova.recommendation.UserContext;
import com.di.insightnova.recommendation.UserContextStore;
import com.di.insightnova.scaling.WorkloadSample;
import com.di.insightnova.scaling.WorkloadSampleStore;
import com.di.insightnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Alert job and alert API. Turns fresh high-confidence insights and workload anomalies into at
 * most one alert each, hands pending alerts to the notification channel and applies status
 * callbacks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    static final String LOAD_SERIES = "system_load_pct";

    private final InsightStore insightStore;
    private final AlertStore alertStore;
    private final AlertEvaluator evaluator;
    private final NotificationChannel notificationChannel;
    private final WorkloadSampleStore workloadSampleStore;
    private final UserContextStore userContextStore;
    private final PipelineProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    // ------------------------------------------------------------------ //
    // Insight triggers
    // ------------------------------------------------------------------ //

    /**
     * Evaluates insights created within the lookback that have no alert yet.
     *
     * @return number of alerts created
     */
    public int processAlertTriggers() {
        Instant now = clock.instant();
        List<StreamInsight> candidates = selectCandidates(now);
        if (candidates.isEmpty()) {
            log.debug("[ALERT] No alert candidates");
            return 0;
        }

        int created = 0;
        for (StreamInsight insight : candidates) {
            try {
                if (evaluateInsight(insight, audienceFor(insight, now), now)) {
                    created++;
                }
            } catch (InferenceUnavailableException e) {
                log.warn("[ALERT] Inference unavailable for insight {}, retrying next cycle: {}", insight.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("[ALERT] Evaluation failed for insight {}", insight.getId(), e);
            }
        }
        log.info("[ALERT] Evaluated {} candidate(s), created {} alert(s)", candidates.size(), created);
        return created;
    }

    /**
     * Confident insights without an alert, at most one per stream event: the most confident
     * insight stands for its event, and an event that already raised an alert is skipped.
     */
    private List<StreamInsight> selectCandidates(Instant now) {
        Set<String> events = new HashSet<>();
        List<StreamInsight> candidates = new ArrayList<>();
        for (StreamInsight insight : insightStore.findConfidentSince(now.minus(config().getLookback()), config().getMinConfidence())) {
            if (candidates.size() >= config().getCandidateLimit()) {
                break;
            }
            if (!events.add(insight.getSourceItemId()) || eventAlerted(insight.getSourceItemId())) {
                continue;
            }
            candidates.add(insight);
        }
        return candidates;
    }

    private boolean eventAlerted(String streamEventId) {
        return insightStore.findBySourceItem(streamEventId).stream()
                .anyMatch(i -> alertStore.existsBySourceKey(i.getId()));
    }

    /** The targeted user's context when the insight names one, otherwise the configured audience. */
    private AlertAudience audienceFor(StreamInsight insight, Instant now) {
        String role = config().getDefaultRole();
        List<String> projects = config().getDefaultProjects();
        Optional<UserContext> context = Optional.ofNullable(insight.getTargetUsers())
                .flatMap(userContextStore::find)
                .filter(c -> c.getExpiresAt() == null || c.getExpiresAt().isAfter(now));
        if (context.isPresent()) {
            UserContext user = context.get();
            if (user.getRole() != null && !user.getRole().isBlank()) {
                role = user.getRole();
            }
            if (user.getActiveProjects() != null && !user.getActiveProjects().isEmpty()) {
                projects = user.getActiveProjects();
            }
        }
        return new AlertAudience(role, projects);
    }

    private boolean evaluateInsight(StreamInsight insight, AlertAudience audience, Instant now) {
        String context = String.format(Locale.ROOT, "%s insight, urgency %s, confidence %.2f",
                insight.getType(), insight.getUrgency(), insight.getConfidence());
        SignificanceAssessment assessment = evaluator.evaluate(insight.getContent(), context);
        if (!assessment.isSignificant()) {
            log.debug("[ALERT] Insight {} not significant (score={})", insight.getId(), assessment.getScore());
            return false;
        }
        ComposedAlert composed = evaluator.compose(insight.getContent(), assessment, audience);
        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .sourceKey(insight.getId())
                .sourceType(AlertSourceType.INSIGHT)
                .significanceScore(assessment.getScore())
                .urgency(composed.getUrgency())
                .message(composed.getMessage())
                .personalizedMessage(composed.getPersonalizedMessage())
                .explanation(assessment.getExplanation())
                .recommendedAction(assessment.getRecommendedAction())
                .notificationStatus(NotificationStatus.PENDING)
                .triggeredAt(now)
                .build();
        return store(alert);
    }

    // ------------------------------------------------------------------ //
    // Workload anomalies
    // ------------------------------------------------------------------ //

    /**
     * Checks the recent system-load series once per newest sample.
     *
     * @return true when an anomaly alert was created
     */
    public boolean detectWorkloadAnomalies() {
        List<WorkloadSample> recent = new ArrayList<>(workloadSampleStore.findRecent(config().getAnomalySeriesPoints()));
        if (recent.size() < 3) {
            log.debug("[ALERT] Only {} workload sample(s), skipping anomaly check", recent.size());
            return false;
        }
        Collections.reverse(recent);
        WorkloadSample last = recent.get(recent.size() - 1);
        String sourceKey = "anomaly:" + LOAD_SERIES + ":" + last.getSampledAt();
        if (alertStore.existsBySourceKey(sourceKey)) {
            return false;
        }

        List<SeriesPoint> series = recent.stream()
                .map(s -> new SeriesPoint(s.getSampledAt(), s.getSystemLoadPct()))
                .collect(Collectors.toList());
        AnomalyAssessment assessment;
        try {
            assessment = evaluator.detectAnomaly(series, LOAD_SERIES);
        } catch (InferenceUnavailableException e) {
            log.warn("[ALERT] Inference unavailable for anomaly check: {}", e.getMessage());
            return false;
        }
        if (!assessment.isAnomalyDetected() || assessment.getConfidence() < config().getAnomalyConfidenceThreshold()) {
            return false;
        }

        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .sourceKey(sourceKey)
                .sourceType(AlertSourceType.ANOMALY)
                .significanceScore(assessment.getConfidence())
                .urgency(Urgency.fromScore(assessment.getConfidence()))
                .message("Workload anomaly: " + assessment.getDescription())
                .explanation(assessment.getDescription())
                .recommendedAction(String.join("\n", assessment.getInvestigationSteps()))
                .notificationStatus(NotificationStatus.PENDING)
                .triggeredAt(clock.instant())
                .build();
        return store(alert);
    }

    private boolean store(Alert alert) {
        if (!alertStore.saveIfAbsent(alert)) {
            log.debug("[ALERT] Alert for {} already exists", alert.getSourceKey());
            return false;
        }
        metricsCollector.recordAlertCreated(alert.getSourceType().name(), alert.getUrgency().name());
        log.info("[ALERT] Created {} alert {} for {} (urgency={}, score={})", alert.getSourceType(), alert.getId(),
                alert.getSourceKey(), alert.getUrgency(), String.format(Locale.ROOT, "%.2f", alert.getSignificanceScore()));
        return true;
    }

    // ------------------------------------------------------------------ //
    // Notification
    // ------------------------------------------------------------------ //

    /** @return number of alerts the channel accepted */
    public int dispatchNotifications() {
        int sent = 0;
        for (Alert alert : alertStore.findUndispatched(config().getDispatchBatchSize())) {
            boolean accepted;
            try {
                accepted = notificationChannel.deliver(alert);
            } catch (RuntimeException e) {
                log.warn("[ALERT] Notification channel failed for alert {}: {}", alert.getId(), e.getMessage());
                accepted = false;
            }
            metricsCollector.recordNotification(accepted);
            if (!accepted) {
                continue;
            }
            Instant now = clock.instant();
            alertStore.update(alert.getId(), a -> a.getNotificationStatus() == NotificationStatus.PENDING
                    ? a.toBuilder().notificationStatus(NotificationStatus.SENT).dispatchedAt(now).build()
                    : a.toBuilder().dispatchedAt(now).build());
            sent++;
        }
        if (sent > 0) {
            log.info("[ALERT] Dispatched {} notification(s)", sent);
        }
        return sent;
    }

    /**
     * Applies a notification status callback. Repeating the current status is a no-op; moving
     * backwards is rejected.
     */
    @LogJob(eventType = "ALERT_STATUS", operation = "notification_status_update", parameterNames = {"alertId", "status"})
    public Alert updateNotificationStatus(String alertId, NotificationStatus status) {
        Instant now = clock.instant();
        return alertStore.update(alertId, current -> {
            if (current.getNotificationStatus() == status) {
                return current;
            }
            if (!current.getNotificationStatus().canMoveTo(status)) {
                throw new IllegalStatusTransitionException("alert", alertId, current.getNotificationStatus(), status);
            }
            Alert.AlertBuilder next = current.toBuilder().notificationStatus(status);
            if (status == NotificationStatus.SENT && current.getDispatchedAt() == null) {
                next.dispatchedAt(now);
            }
            if (status == NotificationStatus.ACKNOWLEDGED) {
                next.acknowledgedAt(now);
            }
            if (status == NotificationStatus.RESOLVED) {
                next.resolvedAt(now);
            }
            return next.build();
        }).orElseThrow(() -> new ResourceNotFoundException("alert", alertId));
    }

    public List<Alert> listAlerts(NotificationStatus status, int limit) {
        return alertStore.findRecent(status, limit);
    }

    private PipelineProperties.AlertConfig config() {
        return properties.getAlerts();
    }
}
