package com.di.insightnova.alert;

import com.di.insightnova.exception.IllegalStatusTransitionException;
import com.di.insightnova.exception.ResourceNotFoundException;
import com.di.insightnova.insight.InsightType;
import com.di.insightnova.insight.StreamInsight;
import com.di.insightnova.insight.Urgency;
import com.di.insightnova.recommendation.UserContextRequest;
import com.di.insightnova.scaling.InMemoryScalingPolicyStore;
import com.di.insightnova.scaling.WorkloadSample;
import com.di.insightnova.support.InsightNovaFixture;
import com.di.insightnova.support.InMemoryNotificationChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlertService Tests")
class AlertServiceTest {

    private static final String VERDICT = "Determine if this data represents a significant business event";
    private static final String SCORE = "Rate the business significance of this event";

    private InMemoryNotificationChannel channel;
    private InsightNovaFixture f;

    @BeforeEach
    void setUp() {
        channel = new InMemoryNotificationChannel();
        f = new InsightNovaFixture(new InMemoryScalingPolicyStore(), channel);
        f.stub.onBool(true, VERDICT)
                .onDouble(0.85, SCORE)
                .onText("Revenue jumped on the new tariff", "Explain briefly why")
                .onText("Review the EMEA pricing", "Recommend one specific action")
                .onText("ALERT: revenue spike", "Generate a clear, actionable alert message")
                .onText("Hi analyst: revenue spike", "Personalize this alert for a");
    }

    private StreamInsight insight(String id, String content, double confidence) {
        return insight(id, "evt-" + id, InsightType.CONTEXTUAL, "all_users", content, confidence);
    }

    private StreamInsight insight(String id, String eventId, InsightType type, String targetUsers, String content,
                                  double confidence) {
        StreamInsight insight = StreamInsight.builder()
                .id(id)
                .sourceItemId(eventId)
                .type(type)
                .content(content)
                .confidence(confidence)
                .urgency(Urgency.fromScore(confidence))
                .targetUsers(targetUsers)
                .createdAt(f.clock.instant())
                .expiresAt(f.clock.instant().plus(Duration.ofHours(24)))
                .build();
        f.insightStore.saveAll(List.of(insight));
        return insight;
    }

    // =========================================================================
    // Insight triggers
    // =========================================================================

    @Test
    @DisplayName("Should create one fully composed alert for a significant insight")
    void testSignificantInsightCreatesAlert() {
        insight("ins-1", "Revenue up 40% in EMEA", 0.9);

        assertEquals(1, f.alertService.processAlertTriggers());

        List<Alert> alerts = f.alertService.listAlerts(null, 10);
        assertEquals(1, alerts.size());
        Alert alert = alerts.get(0);
        assertEquals("ins-1", alert.getSourceKey());
        assertEquals(AlertSourceType.INSIGHT, alert.getSourceType());
        assertEquals(0.85, alert.getSignificanceScore(), 1e-9);
        assertEquals(Urgency.CRITICAL, alert.getUrgency());
        assertEquals("ALERT: revenue spike", alert.getMessage());
        assertEquals("Hi analyst: revenue spike", alert.getPersonalizedMessage());
        assertEquals("Revenue jumped on the new tariff", alert.getExplanation());
        assertEquals("Review the EMEA pricing", alert.getRecommendedAction());
        assertEquals(NotificationStatus.PENDING, alert.getNotificationStatus());
        assertEquals(1, f.stub.count("Personalize this alert for a business_analyst working on operations"));
    }

    @Test
    @DisplayName("Should never alert twice for the same insight")
    void testDeduplication() {
        insight("ins-1", "Revenue up 40% in EMEA", 0.9);

        assertEquals(1, f.alertService.processAlertTriggers());
        assertEquals(0, f.alertService.processAlertTriggers());

        assertEquals(1, f.alertStore.findRecent(null, 10).size());
        assertEquals(1, f.stub.count(VERDICT));
    }

    @Test
    @DisplayName("Should raise one alert per stream event, from its most confident insight")
    void testOneAlertPerStreamEvent() {
        insight("ins-ctx", "evt-1", InsightType.CONTEXTUAL, "all_users", "Revenue up 40% in EMEA", 0.9);
        insight("ins-rec", "evt-1", InsightType.RECOMMENDATION, "all_users", "Add EMEA stock", 0.81);

        assertEquals(1, f.alertService.processAlertTriggers());
        assertTrue(f.alertStore.existsBySourceKey("ins-ctx"));
        assertFalse(f.alertStore.existsBySourceKey("ins-rec"));

        assertEquals(0, f.alertService.processAlertTriggers());
        assertEquals(1, f.alertStore.findRecent(null, 10).size());
        assertEquals(1, f.stub.count(VERDICT));
    }

    @Test
    @DisplayName("Should require a score of at least 0.7")
    void testScoreThreshold() {
        insight("ins-low", "Minor uptick in returns", 0.9);
        insight("ins-edge", "Revenue up 40% in EMEA", 0.9);
        f.stub.onDouble(0.69, SCORE, "Minor uptick")
                .onDouble(0.7, SCORE, "Revenue up 40%");

        assertEquals(1, f.alertService.processAlertTriggers());

        assertTrue(f.alertStore.existsBySourceKey("ins-edge"));
        assertFalse(f.alertStore.existsBySourceKey("ins-low"));
        assertEquals(Urgency.HIGH, f.alertStore.findRecent(null, 1).get(0).getUrgency());
    }

    @Test
    @DisplayName("Should not alert on a negative verdict however high the score")
    void testNegativeVerdict() {
        insight("ins-1", "Routine restock", 0.9);
        f.stub.onBool(false, VERDICT, "Routine restock").onDouble(0.95, SCORE);

        assertEquals(0, f.alertService.processAlertTriggers());
        assertEquals(0, f.stub.count("Explain briefly why"));
        assertEquals(0, f.stub.count("Generate a clear, actionable alert message"));
    }

    @Test
    @DisplayName("Should only consider recent insights with confidence above 0.6")
    void testCandidateSelection() {
        insight("ins-boundary", "Exactly at the bar", 0.6);
        insight("ins-old", "Old news", 0.9);
        f.clock.advance(Duration.ofMinutes(16));
        insight("ins-new", "Revenue up 40% in EMEA", 0.61);

        assertEquals(1, f.alertService.processAlertTriggers());

        assertTrue(f.alertStore.existsBySourceKey("ins-new"));
        assertEquals(0, f.stub.count("Exactly at the bar"));
        assertEquals(0, f.stub.count("Old news"));
    }

    @Test
    @DisplayName("Should retry an insight next cycle when inference is unavailable")
    void testInferenceUnavailable() {
        insight("ins-1", "Revenue up 40% in EMEA", 0.9);
        f.stub.unavailable(true);

        assertEquals(0, f.alertService.processAlertTriggers());

        f.stub.unavailable(false);
        assertEquals(1, f.alertService.processAlertTriggers());
    }

    // =========================================================================
    // Notification
    // =========================================================================

    @Test
    @DisplayName("Should hand pending alerts to the channel once and mark them SENT")
    void testDispatch() {
        insight("ins-1", "Revenue up 40% in EMEA", 0.9);
        f.alertService.processAlertTriggers();

        assertEquals(1, f.alertService.dispatchNotifications());
        assertEquals(0, f.alertService.dispatchNotifications());

        assertEquals(1, channel.delivered().size());
        Alert alert = f.alertStore.findRecent(null, 1).get(0);
        assertEquals(NotificationStatus.SENT, alert.getNotificationStatus());
        assertEquals(f.clock.instant(), alert.getDispatchedAt());
    }

    @Test
    @DisplayName("Should keep an alert PENDING when the channel rejects it")
    void testDispatchRejected() {
        insight("ins-1", "Revenue up 40% in EMEA", 0.9);
        f.alertService.processAlertTriggers();
        channel.accept(false);

        assertEquals(0, f.alertService.dispatchNotifications());
        assertEquals(NotificationStatus.PENDING, f.alertStore.findRecent(null, 1).get(0).getNotificationStatus());

        channel.accept(true);
        assertEquals(1, f.alertService.dispatchNotifications());
    }

    @Test
    @DisplayName("Should move status forward only, stamping acknowledgement and resolution")
    void testStatusTransitions() {
        insight("ins-1", "Revenue up 40% in EMEA", 0.9);
        f.alertService.processAlertTriggers();
        String id = f.alertStore.findRecent(null, 1).get(0).getId();

        f.clock.advance(Duration.ofMinutes(5));
        Alert acked = f.alertService.updateNotificationStatus(id, NotificationStatus.ACKNOWLEDGED);
        assertEquals(NotificationStatus.ACKNOWLEDGED, acked.getNotificationStatus());
        assertEquals(f.clock.instant(), acked.getAcknowledgedAt());

        Alert again = f.alertService.updateNotificationStatus(id, NotificationStatus.ACKNOWLEDGED);
        assertEquals(acked, again);

        assertThrows(IllegalStatusTransitionException.class,
                () -> f.alertService.updateNotificationStatus(id, NotificationStatus.SENT));

        f.clock.advance(Duration.ofMinutes(5));
        Alert resolved = f.alertService.updateNotificationStatus(id, NotificationStatus.RESOLVED);
        assertEquals(f.clock.instant(), resolved.getResolvedAt());

        assertThrows(ResourceNotFoundException.class,
                () -> f.alertService.updateNotificationStatus("missing", NotificationStatus.SENT));
    }

    // =========================================================================
    // Workload anomalies
    // =========================================================================

    private void sample(double loadPct) {
        f.workloadSampleStore.save(WorkloadSample.builder()
                .id("ws-" + f.clock.instant())
                .sampledAt(f.clock.instant())
                .systemLoadPct(loadPct)
                .build());
        f.clock.advance(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should raise one anomaly alert per newest sample")
    void testWorkloadAnomaly() {
        f.stub.onBool(true, "Analyze this time series data for anomalies")
                .onText("Load tripled in five minutes", "Describe any anomalies")
                .onDouble(0.9, "Rate confidence in anomaly detection")
                .onText("- check ingest sources\n- inspect gateway latency", "Suggest specific investigation steps");
        sample(20);
        sample(22);
        sample(95);

        assertTrue(f.alertService.detectWorkloadAnomalies());
        assertFalse(f.alertService.detectWorkloadAnomalies());

        Alert alert = f.alertStore.findRecent(null, 1).get(0);
        assertEquals(AlertSourceType.ANOMALY, alert.getSourceType());
        assertTrue(alert.getSourceKey().startsWith("anomaly:system_load_pct:"));
        assertEquals(Urgency.CRITICAL, alert.getUrgency());
        assertEquals("check ingest sources\ninspect gateway latency", alert.getRecommendedAction());
        assertEquals(1, f.stub.count("Analyze this time series data for anomalies"));
    }

    @Test
    @DisplayName("Should skip the anomaly check with fewer than three samples")
    void testTooFewSamples() {
        sample(20);
        sample(95);

        assertFalse(f.alertService.detectWorkloadAnomalies());
        assertEquals(0, f.stub.count("Analyze this time series data"));
    }

    @Test
    @DisplayName("Should not alert on a low-confidence anomaly or stop after a negative verdict")
    void testAnomalyRejected() {
        f.stub.onBool(false, "Analyze this time series data for anomalies");
        sample(20);
        sample(21);
        sample(22);

        assertFalse(f.alertService.detectWorkloadAnomalies());
        assertEquals(0, f.stub.count("Describe any anomalies"));

        f.stub.onBool(true, "Analyze this time series data for anomalies")
                .onDouble(0.5, "Rate confidence in anomaly detection");
        sample(60);
        assertFalse(f.alertService.detectWorkloadAnomalies());
        assertTrue(f.alertStore.findRecent(null, 10).isEmpty());
    }

    // =========================================================================
    // Audience
    // =========================================================================

    @Test
    @DisplayName("Should personalise for the targeted user's role and projects")
    void testAudienceFromUserContext() {
        UserContextRequest request = new UserContextRequest();
        request.setRole("ops_manager");
        request.setActiveProjects(List.of("acme-account", "emea-launch"));
        f.recommendationService.upsertContext("u-7", request);
        insight("ins-1", "evt-1", InsightType.CONTEXTUAL, "u-7", "Revenue up 40% in EMEA", 0.9);

        assertEquals(1, f.alertService.processAlertTriggers());

        assertEquals(1, f.stub.count("Personalize this alert for a ops_manager working on acme-account, emea-launch"));
        assertEquals(0, f.stub.count("business_analyst"));
    }

    @Test
    @DisplayName("Should fall back to the configured audience without a user context")
    void testDefaultAudience() {
        insight("ins-1", "evt-1", InsightType.CONTEXTUAL, "u-unknown", "Revenue up 40% in EMEA", 0.9);

        assertEquals(1, f.alertService.processAlertTriggers());

        assertEquals(1, f.stub.count("Personalize this alert for a business_analyst working on operations"));
    }
}
