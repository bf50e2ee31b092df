package com.di.insightnova.scaling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScalingDecisionEngine Tests")
class ScalingDecisionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private ScalingDecisionEngine engine;
    private ScalingPolicy policy;

    @BeforeEach
    void setUp() {
        engine = new ScalingDecisionEngine(new ScalingProperties());
        policy = ScalingPolicy.builder()
                .resourceType(ResourceType.COMPUTE)
                .minCapacity(100)
                .maxCapacity(2000)
                .currentCapacity(500)
                .scaleUpThreshold(80)
                .scaleDownThreshold(30)
                .scaleUpIncrement(200)
                .scaleDownIncrement(100)
                .cooldown(Duration.ofMinutes(5))
                .unitCost(0.01)
                .active(true)
                .lastState(ScalingState.EVALUATING)
                .build();
    }

    private static WorkloadSample sample(double load, Double forecast, Instant at) {
        return WorkloadSample.builder()
                .id("s")
                .sampledAt(at)
                .systemLoadPct(load)
                .predictedLoad(forecast)
                .forecastAvailable(forecast != null)
                .build();
    }

    // =========================================================================
    // With a forecast
    // =========================================================================

    @Test
    @DisplayName("Should scale up when the forecast alone crosses the up threshold")
    void testForecastTriggersScaleUp() {
        ScalingDecision d = engine.decide(policy, sample(50, 85.0, NOW), NOW);

        assertEquals(ScalingAction.SCALE_UP, d.getAction());
        assertEquals(700, d.getTargetCapacity());
        assertEquals(85.0, d.getForecast());
        assertTrue(d.changesCapacity());
    }

    @Test
    @DisplayName("Should scale down only when load and forecast are both low")
    void testScaleDownNeedsBoth() {
        assertEquals(ScalingAction.SCALE_DOWN, engine.decide(policy, sample(10, 20.0, NOW), NOW).getAction());
        assertEquals(400, engine.decide(policy, sample(10, 20.0, NOW), NOW).getTargetCapacity());
        assertEquals(ScalingAction.MAINTAIN, engine.decide(policy, sample(10, 40.0, NOW), NOW).getAction());
    }

    @Test
    @DisplayName("Should maintain at exactly the up threshold")
    void testThresholdIsStrict() {
        ScalingDecision d = engine.decide(policy, sample(80, 80.0, NOW), NOW);
        assertEquals(ScalingAction.MAINTAIN, d.getAction());
        assertFalse(d.changesCapacity());
    }

    // =========================================================================
    // Without a usable forecast
    // =========================================================================

    @Test
    @DisplayName("Should widen thresholds when no forecast is available")
    void testNoForecastWidensThresholds() {
        ScalingDecision within = engine.decide(policy, sample(84, null, NOW), NOW);
        assertEquals(ScalingAction.MAINTAIN, within.getAction());
        assertEquals(85.0, within.getUpThreshold(), 1e-9);
        assertEquals(25.0, within.getDownThreshold(), 1e-9);
        assertNull(within.getForecast());

        assertEquals(ScalingAction.SCALE_UP, engine.decide(policy, sample(86, null, NOW), NOW).getAction());
        assertEquals(ScalingAction.SCALE_DOWN, engine.decide(policy, sample(24, null, NOW), NOW).getAction());
    }

    @Test
    @DisplayName("Should ignore the forecast of a stale sample")
    void testStaleSample() {
        Instant old = NOW.minus(Duration.ofMinutes(11));
        ScalingDecision d = engine.decide(policy, sample(50, 99.0, old), NOW);

        assertEquals(ScalingAction.MAINTAIN, d.getAction());
        assertNull(d.getForecast());
        assertTrue(d.getRationale().startsWith("stale sample"));
    }

    @Test
    @DisplayName("Should maintain without a sample")
    void testNoSample() {
        ScalingDecision d = engine.decide(policy, null, NOW);
        assertEquals(ScalingAction.MAINTAIN, d.getAction());
        assertEquals("no workload sample", d.getRationale());
    }

    // =========================================================================
    // Bounds
    // =========================================================================

    @Test
    @DisplayName("Should clamp the target into the capacity bounds")
    void testTargetCapacityBounds() {
        ScalingPolicy nearMax = policy.toBuilder().currentCapacity(1900).build();
        ScalingPolicy nearMin = policy.toBuilder().currentCapacity(150).build();

        assertEquals(2000, ScalingDecisionEngine.targetCapacity(nearMax, ScalingAction.SCALE_UP));
        assertEquals(100, ScalingDecisionEngine.targetCapacity(nearMin, ScalingAction.SCALE_DOWN));
        assertEquals(150, ScalingDecisionEngine.targetCapacity(nearMin, ScalingAction.MAINTAIN));
    }

    @Test
    @DisplayName("Should turn a scale-up at max capacity into MAINTAIN")
    void testAtMax() {
        ScalingPolicy atMax = policy.toBuilder().currentCapacity(2000).build();
        ScalingDecision d = engine.decide(atMax, sample(99, 99.0, NOW), NOW);

        assertEquals(ScalingAction.MAINTAIN, d.getAction());
        assertTrue(d.getRationale().endsWith("already at max capacity"));
    }
}
