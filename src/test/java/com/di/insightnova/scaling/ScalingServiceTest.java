package com.di.insightnova.scaling;

import com.di.insightnova.alert.LoggingNotificationChannel;
import com.di.insightnova.support.InsightNovaFixture;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScalingService Tests")
class ScalingServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private RacingPolicyStore policyStore;
    private InsightNovaFixture f;

    @BeforeEach
    void setUp() {
        policyStore = new RacingPolicyStore();
        f = new InsightNovaFixture(policyStore, new LoggingNotificationChannel());
        f.scalingProperties.setBacklogCapacity(100);
        f.scalingService.seedDefaultPolicies();
    }

    private void backlog(int items) {
        for (int i = 0; i < items; i++) {
            f.ingestionService.ingest("orders", mapper.createObjectNode().put("content", "order " + i), null);
        }
    }

    private ScalingPolicy policy(ResourceType type) {
        return policyStore.findByType(type).orElseThrow();
    }

    private static ScalingOutcome outcome(List<ScalingOutcome> outcomes, ResourceType type) {
        return outcomes.stream().filter(o -> o.getResourceType() == type).findFirst().orElseThrow();
    }

    private PolicyUpdateRequest request() {
        return new PolicyUpdateRequest();
    }

    // =========================================================================
    // Cycle
    // =========================================================================

    @Test
    @DisplayName("Should scale every seeded policy up under a heavy backlog")
    void testScaleUpUnderLoad() {
        backlog(95);

        List<ScalingOutcome> outcomes = f.scalingService.runScalingCycle();

        assertEquals(List.of(ResourceType.COMPUTE, ResourceType.MEMORY, ResourceType.AI_QUOTA),
                outcomes.stream().map(ScalingOutcome::getResourceType).collect(Collectors.toList()));
        ScalingOutcome compute = outcome(outcomes, ResourceType.COMPUTE);
        assertEquals(ScalingOutcome.Status.EXECUTED, compute.getStatus());
        assertEquals(100, compute.getFromCapacity());
        assertEquals(300, compute.getToCapacity());
        assertEquals(CostRecommendation.HIGHLY_RECOMMENDED, compute.getCostBenefit().getRecommendation());

        ScalingPolicy stored = policy(ResourceType.COMPUTE);
        assertEquals(300, stored.getCurrentCapacity());
        assertEquals(1, stored.getVersion());
        assertEquals(ScalingState.COOLDOWN, stored.getLastState());
        assertEquals(f.clock.instant(), stored.getLastActionAt());

        assertEquals(3, f.scalingService.getEvents(10).size());
        assertTrue(f.scalingService.getEvents(10).stream().allMatch(ScalingEvent::isExecuted));
        assertEquals(95.0, f.scalingService.getSamples(1).get(0).getSystemLoadPct(), 1e-9);
    }

    @Test
    @DisplayName("Should hold each policy in cooldown for its own period")
    void testCooldown() {
        backlog(95);
        f.scalingService.runScalingCycle();

        List<ScalingOutcome> again = f.scalingService.runScalingCycle();
        assertTrue(again.stream().allMatch(o -> o.getStatus() == ScalingOutcome.Status.COOLDOWN));

        f.clock.advance(Duration.ofMinutes(5));
        List<ScalingOutcome> later = f.scalingService.runScalingCycle();
        assertEquals(ScalingOutcome.Status.EXECUTED, outcome(later, ResourceType.COMPUTE).getStatus());
        assertEquals(500, policy(ResourceType.COMPUTE).getCurrentCapacity());
        assertEquals(ScalingOutcome.Status.COOLDOWN, outcome(later, ResourceType.MEMORY).getStatus());
    }

    @Test
    @DisplayName("Should only record a scale-up whose ROI is too low")
    void testLowRoiIsRecommendedOnly() {
        PolicyUpdateRequest expensive = request();
        expensive.setUnitCost(1.0);
        f.scalingService.upsertPolicy(ResourceType.COMPUTE, expensive);
        backlog(95);

        ScalingOutcome compute = outcome(f.scalingService.runScalingCycle(), ResourceType.COMPUTE);

        assertEquals(ScalingOutcome.Status.RECOMMENDED_ONLY, compute.getStatus());
        assertEquals(ScalingAction.SCALE_UP, compute.getAction());
        assertEquals(0.25, compute.getCostBenefit().getRoi(), 1e-9);
        assertEquals(100, policy(ResourceType.COMPUTE).getCurrentCapacity());
        assertNull(policy(ResourceType.COMPUTE).getLastActionAt());
        ScalingEvent suggestion = f.scalingService.getEvents(10).stream()
                .filter(e -> e.getResourceType() == ResourceType.COMPUTE && !e.isExecuted())
                .findFirst().orElseThrow();
        assertEquals(CostRecommendation.CONSIDER, suggestion.getRecommendation());
        assertEquals(CostRecommendation.NOT_RECOMMENDED, compute.getCostBenefit().getRecommendation());
        assertTrue(suggestion.getRationale().contains("roi class NOT_RECOMMENDED"));
    }

    @Test
    @DisplayName("Should stop at max capacity and then maintain")
    void testCapacityBounds() {
        PolicyUpdateRequest nearMax = request();
        nearMax.setCurrentCapacity(1900);
        f.scalingService.upsertPolicy(ResourceType.COMPUTE, nearMax);
        backlog(95);

        ScalingOutcome first = outcome(f.scalingService.runScalingCycle(), ResourceType.COMPUTE);
        assertEquals(ScalingOutcome.Status.EXECUTED, first.getStatus());
        assertEquals(2000, first.getToCapacity());

        f.clock.advance(Duration.ofMinutes(5));
        ScalingOutcome second = outcome(f.scalingService.runScalingCycle(), ResourceType.COMPUTE);
        assertEquals(ScalingOutcome.Status.MAINTAINED, second.getStatus());
        assertEquals(2000, policy(ResourceType.COMPUTE).getCurrentCapacity());
    }

    @Test
    @DisplayName("Should scale down when the backlog is empty")
    void testScaleDownWhenIdle() {
        PolicyUpdateRequest large = request();
        large.setCurrentCapacity(500);
        f.scalingService.upsertPolicy(ResourceType.COMPUTE, large);

        ScalingOutcome compute = outcome(f.scalingService.runScalingCycle(), ResourceType.COMPUTE);

        assertEquals(ScalingAction.SCALE_DOWN, compute.getAction());
        assertEquals(ScalingOutcome.Status.EXECUTED, compute.getStatus());
        assertEquals(400, policy(ResourceType.COMPUTE).getCurrentCapacity());
        assertEquals(CostRecommendation.COST_SAVING, compute.getCostBenefit().getRecommendation());
        assertEquals(ScalingOutcome.Status.MAINTAINED,
                outcome(f.scalingService.runScalingCycle(), ResourceType.MEMORY).getStatus());
    }

    @Test
    @DisplayName("Should fall back to widened thresholds without a forecast")
    void testForecastUnavailable() {
        f.stub.forecastUnavailable(true);
        backlog(95);

        List<ScalingOutcome> outcomes = f.scalingService.runScalingCycle();

        assertFalse(f.scalingService.getSamples(1).get(0).isForecastAvailable());
        assertEquals(ScalingOutcome.Status.EXECUTED, outcome(outcomes, ResourceType.COMPUTE).getStatus());
        assertEquals(ScalingOutcome.Status.MAINTAINED, outcome(outcomes, ResourceType.AI_QUOTA).getStatus());
    }

    @Test
    @DisplayName("Should drop the decision when the policy changes concurrently")
    void testConcurrentWriteLosesCycle() {
        backlog(95);
        policyStore.raceNextWrite();

        ScalingOutcome compute = outcome(f.scalingService.runScalingCycle(), ResourceType.COMPUTE);

        assertEquals(ScalingOutcome.Status.CONFLICT, compute.getStatus());
        assertEquals(100, policy(ResourceType.COMPUTE).getCurrentCapacity());
        assertTrue(f.scalingService.getEvents(10).stream().noneMatch(e -> e.getResourceType() == ResourceType.COMPUTE));
    }

    // =========================================================================
    // Policy API
    // =========================================================================

    @Test
    @DisplayName("Should report COOLDOWN as EVALUATING once the cooldown has elapsed")
    void testEffectiveState() {
        backlog(95);
        f.scalingService.runScalingCycle();
        f.clock.advance(Duration.ofMinutes(5));

        List<ScalingPolicy> policies = f.scalingService.getPolicies();

        assertEquals(ScalingState.EVALUATING, policies.stream()
                .filter(p -> p.getResourceType() == ResourceType.COMPUTE).findFirst().orElseThrow().getLastState());
        assertEquals(ScalingState.COOLDOWN, policies.stream()
                .filter(p -> p.getResourceType() == ResourceType.MEMORY).findFirst().orElseThrow().getLastState());
        assertEquals(ScalingState.COOLDOWN, policy(ResourceType.COMPUTE).getLastState());
    }

    @Test
    @DisplayName("Should merge partial updates and bump the version")
    void testPartialUpdate() {
        PolicyUpdateRequest r = request();
        r.setScaleUpThreshold(70.0);
        r.setCooldownSeconds(60L);

        ScalingPolicy updated = f.scalingService.upsertPolicy(ResourceType.COMPUTE, r);

        assertEquals(70.0, updated.getScaleUpThreshold(), 1e-9);
        assertEquals(Duration.ofMinutes(1), updated.getCooldown());
        assertEquals(30.0, updated.getScaleDownThreshold(), 1e-9);
        assertEquals(100, updated.getCurrentCapacity());
        assertEquals(1, updated.getVersion());
    }

    @Test
    @DisplayName("Should create a policy only from a complete request")
    void testCreatePolicy() {
        assertThrows(PolicyValidationException.class,
                () -> f.scalingService.upsertPolicy(ResourceType.STORAGE, request()));

        PolicyUpdateRequest r = request();
        r.setMinCapacity(10);
        r.setMaxCapacity(100);
        r.setScaleUpThreshold(75.0);
        r.setScaleDownThreshold(25.0);
        r.setScaleUpIncrement(10);
        r.setScaleDownIncrement(5);

        ScalingPolicy created = f.scalingService.upsertPolicy(ResourceType.STORAGE, r);

        assertEquals(10, created.getCurrentCapacity());
        assertEquals(0, created.getVersion());
        assertEquals(Duration.ZERO, created.getCooldown());
        assertTrue(created.isActive());
    }

    @Test
    @DisplayName("Should reject invalid updates and lost races")
    void testUpsertRejections() {
        PolicyUpdateRequest bad = request();
        bad.setScaleDownThreshold(95.0);
        assertThrows(PolicyValidationException.class, () -> f.scalingService.upsertPolicy(ResourceType.COMPUTE, bad));
        assertEquals(0, policy(ResourceType.COMPUTE).getVersion());

        policyStore.raceNextWrite();
        PolicyUpdateRequest ok = request();
        ok.setUnitCost(0.02);
        assertThrows(OptimisticLockingFailureException.class,
                () -> f.scalingService.upsertPolicy(ResourceType.COMPUTE, ok));
    }

    @Test
    @DisplayName("Should skip inactive policies")
    void testInactivePolicy() {
        PolicyUpdateRequest off = request();
        off.setActive(false);
        f.scalingService.upsertPolicy(ResourceType.MEMORY, off);
        backlog(95);

        List<ScalingOutcome> outcomes = f.scalingService.runScalingCycle();

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().noneMatch(o -> o.getResourceType() == ResourceType.MEMORY));
    }

    @Test
    @DisplayName("Should compute system load as backlog over capacity, capped at 100")
    void testSystemLoad() {
        assertEquals(95.0, WorkloadMonitor.systemLoad(95, 100), 1e-9);
        assertEquals(100.0, WorkloadMonitor.systemLoad(500, 100), 1e-9);
        assertEquals(100.0, WorkloadMonitor.systemLoad(1, 0), 1e-9);
    }

    /** Lets a test slip in a concurrent writer just before the next compare-and-set. */
    static class RacingPolicyStore extends InMemoryScalingPolicyStore {

        private boolean raceNext;

        void raceNextWrite() {
            raceNext = true;
        }

        @Override
        public boolean compareAndSet(ScalingPolicy updated, long expectedVersion) {
            if (raceNext) {
                raceNext = false;
                ScalingPolicy current = findByType(updated.getResourceType()).orElseThrow();
                super.compareAndSet(current, current.getVersion());
            }
            return super.compareAndSet(updated, expectedVersion);
        }
    }
}
