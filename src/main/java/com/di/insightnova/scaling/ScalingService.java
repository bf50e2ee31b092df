package com.di.insightnova.scaling;

import com.di.insightnova.aspect.LogJob;
import com.di.insightnova.exception.ResourceNotFoundException;
import com.di.insightnova.performance.BaselineService;
import com.di.insightnova.performance.RegressionFinding;
import com.di.insightnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Closed-loop scaling controller: samples the workload, then runs every active policy through
 * cooldown, threshold and cost/benefit checks. Capacity changes are written with a
 * compare-and-set on the policy version; a lost race drops the decision until the next cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScalingService {

    private final ScalingPolicyStore policyStore;
    private final ScalingEventStore eventStore;
    private final WorkloadSampleStore sampleStore;
    private final WorkloadMonitor workloadMonitor;
    private final ScalingDecisionEngine decisionEngine;
    private final CostBenefitCalculator costBenefitCalculator;
    private final ScalingPolicyValidator validator;
    private final BaselineService baselineService;
    private final ScalingProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void seedDefaultPolicies() {
        for (ScalingProperties.PolicySeed seed : properties.getDefaults()) {
            ScalingPolicy policy = seed.toPolicy();
            validator.validate(policy);
            if (policyStore.insertIfAbsent(policy)) {
                log.info("[SCALING] Seeded default {} policy: capacity {} in [{}, {}]",
                        policy.getResourceType(), policy.getCurrentCapacity(), policy.getMinCapacity(), policy.getMaxCapacity());
            }
        }
    }

    // ------------------------------------------------------------------ //
    // Scaling cycle
    // ------------------------------------------------------------------ //

    public List<ScalingOutcome> runScalingCycle() {
        WorkloadSample sample = workloadMonitor.sample();
        Instant now = clock.instant();
        String regressions = regressionSummary();

        List<ScalingOutcome> outcomes = new ArrayList<>();
        for (ScalingPolicy policy : policyStore.findAll()) {
            if (!policy.isActive()) {
                continue;
            }
            outcomes.add(evaluate(policy, sample, now, regressions));
        }
        long executed = outcomes.stream().filter(o -> o.getStatus() == ScalingOutcome.Status.EXECUTED).count();
        log.info("[SCALING] Cycle finished: {} policies evaluated, {} executed", outcomes.size(), executed);
        return outcomes;
    }

    private ScalingOutcome evaluate(ScalingPolicy policy, WorkloadSample sample, Instant now, String regressions) {
        ScalingOutcome.ScalingOutcomeBuilder outcome = ScalingOutcome.builder()
                .resourceType(policy.getResourceType())
                .fromCapacity(policy.getCurrentCapacity())
                .toCapacity(policy.getCurrentCapacity());

        if (policy.isCoolingDown(now)) {
            log.debug("[SCALING] {} in cooldown until {}", policy.getResourceType(),
                    policy.getLastActionAt().plus(policy.getCooldown()));
            return outcome.action(ScalingAction.MAINTAIN).status(ScalingOutcome.Status.COOLDOWN).build();
        }

        ScalingDecision decision = decisionEngine.decide(policy, sample, now);
        if (!decision.changesCapacity()) {
            metricsCollector.recordScalingDecision(policy.getResourceType().name(), ScalingAction.MAINTAIN.name(), false);
            log.debug("[SCALING] {} maintain: {}", policy.getResourceType(), decision.getRationale());
            return outcome.action(ScalingAction.MAINTAIN).status(ScalingOutcome.Status.MAINTAINED).build();
        }

        CostBenefit costBenefit = costBenefitCalculator.evaluate(
                decision.getCurrentCapacity(), decision.getTargetCapacity(), policy.getUnitCost());
        String rationale = regressions.isEmpty() ? decision.getRationale()
                : decision.getRationale() + "; regressions: " + regressions;
        outcome.action(decision.getAction()).costBenefit(costBenefit);

        if (decision.getAction() == ScalingAction.SCALE_UP && costBenefit.getRoi() < properties.getMinRoi()) {
            // not applied, so the audit trail records it as a suggestion to consider
            eventStore.save(event(decision, costBenefit, CostRecommendation.CONSIDER,
                    rationale + "; roi class " + costBenefit.getRecommendation(), false, now));
            metricsCollector.recordScalingDecision(policy.getResourceType().name(), decision.getAction().name(), false);
            log.info("[SCALING] {} scale-up {} → {} not applied: roi={} below {} ({})",
                    policy.getResourceType(), decision.getCurrentCapacity(), decision.getTargetCapacity(),
                    format(costBenefit.getRoi()), format(properties.getMinRoi()), costBenefit.getRecommendation());
            return outcome.status(ScalingOutcome.Status.RECOMMENDED_ONLY).build();
        }

        ScalingPolicy updated = policy.toBuilder()
                .currentCapacity(decision.getTargetCapacity())
                .lastActionAt(now)
                .lastState(ScalingState.COOLDOWN)
                .build();
        if (!policyStore.compareAndSet(updated, policy.getVersion())) {
            log.warn("[SCALING] {} changed concurrently (version {}), dropping {} for this cycle",
                    policy.getResourceType(), policy.getVersion(), decision.getAction());
            return outcome.status(ScalingOutcome.Status.CONFLICT).build();
        }

        eventStore.save(event(decision, costBenefit, costBenefit.getRecommendation(), rationale, true, now));
        metricsCollector.recordScalingDecision(policy.getResourceType().name(), decision.getAction().name(), true);
        log.info("[SCALING] {} {}: {} → {} (load={}, forecast={}, roi={}, {}) {}",
                policy.getResourceType(), decision.getAction(), decision.getCurrentCapacity(), decision.getTargetCapacity(),
                format(decision.getLoad()), decision.getForecast() != null ? format(decision.getForecast()) : "n/a",
                format(costBenefit.getRoi()), costBenefit.getRecommendation(), rationale);
        return outcome.status(ScalingOutcome.Status.EXECUTED).toCapacity(decision.getTargetCapacity()).build();
    }

    private ScalingEvent event(ScalingDecision decision, CostBenefit costBenefit, CostRecommendation recommendation,
                               String rationale, boolean executed, Instant now) {
        return ScalingEvent.builder()
                .id(UUID.randomUUID().toString())
                .resourceType(decision.getResourceType())
                .action(decision.getAction())
                .fromCapacity(decision.getCurrentCapacity())
                .toCapacity(decision.getTargetCapacity())
                .load(decision.getLoad())
                .forecast(decision.getForecast())
                .roi(costBenefit.getRoi())
                .recommendation(recommendation)
                .rationale(rationale)
                .executed(executed)
                .occurredAt(now)
                .build();
    }

    private String regressionSummary() {
        List<RegressionFinding> findings = baselineService.currentFindings();
        return findings.stream().map(RegressionFinding::describe).collect(Collectors.joining(", "));
    }

    // ------------------------------------------------------------------ //
    // Policy API
    // ------------------------------------------------------------------ //

    /**
     * Policies with their effective controller state: COOLDOWN policies whose cooldown has
     * elapsed are reported as EVALUATING.
     */
    public List<ScalingPolicy> getPolicies() {
        Instant now = clock.instant();
        return policyStore.findAll().stream()
                .map(p -> p.getLastState() == ScalingState.COOLDOWN && !p.isCoolingDown(now)
                        ? p.toBuilder().lastState(ScalingState.EVALUATING).build()
                        : p)
                .collect(Collectors.toList());
    }

    @LogJob(eventType = "SCALING_POLICY", operation = "policy_upsert", parameterNames = {"type"})
    public ScalingPolicy upsertPolicy(ResourceType type, PolicyUpdateRequest request) {
        ScalingPolicy existing = policyStore.findByType(type).orElse(null);
        ScalingPolicy merged = merge(type, existing, request);
        validator.validate(merged);

        boolean written = existing == null
                ? policyStore.insertIfAbsent(merged)
                : policyStore.compareAndSet(merged, existing.getVersion());
        if (!written) {
            throw new OptimisticLockingFailureException("Scaling policy " + type + " was modified concurrently");
        }
        log.info("[SCALING] Policy {} {}: capacity {} in [{}, {}], thresholds {}/{}",
                type, existing == null ? "created" : "updated", merged.getCurrentCapacity(),
                merged.getMinCapacity(), merged.getMaxCapacity(),
                merged.getScaleDownThreshold(), merged.getScaleUpThreshold());
        return policyStore.findByType(type).orElseThrow(() -> new ResourceNotFoundException("scaling policy", type.name()));
    }

    static ScalingPolicy merge(ResourceType type, ScalingPolicy existing, PolicyUpdateRequest r) {
        ScalingPolicy base = existing != null ? existing : ScalingPolicy.builder()
                .resourceType(type)
                .cooldown(Duration.ZERO)
                .active(true)
                .lastState(ScalingState.EVALUATING)
                .build();
        if (existing == null && (r.getMinCapacity() == null || r.getMaxCapacity() == null
                || r.getScaleUpThreshold() == null || r.getScaleDownThreshold() == null
                || r.getScaleUpIncrement() == null || r.getScaleDownIncrement() == null)) {
            throw new PolicyValidationException(type, List.of(
                    "new policy needs minCapacity, maxCapacity, thresholds and increments"));
        }
        ScalingPolicy.ScalingPolicyBuilder b = base.toBuilder();
        if (r.getMinCapacity() != null) b.minCapacity(r.getMinCapacity());
        if (r.getMaxCapacity() != null) b.maxCapacity(r.getMaxCapacity());
        if (r.getCurrentCapacity() != null) {
            b.currentCapacity(r.getCurrentCapacity());
        } else if (existing == null) {
            b.currentCapacity(r.getMinCapacity());
        }
        if (r.getScaleUpThreshold() != null) b.scaleUpThreshold(r.getScaleUpThreshold());
        if (r.getScaleDownThreshold() != null) b.scaleDownThreshold(r.getScaleDownThreshold());
        if (r.getScaleUpIncrement() != null) b.scaleUpIncrement(r.getScaleUpIncrement());
        if (r.getScaleDownIncrement() != null) b.scaleDownIncrement(r.getScaleDownIncrement());
        if (r.getCooldownSeconds() != null) b.cooldown(Duration.ofSeconds(r.getCooldownSeconds()));
        if (r.getUnitCost() != null) b.unitCost(r.getUnitCost());
        if (r.getActive() != null) b.active(r.getActive());
        return b.build();
    }

    public List<ScalingEvent> getEvents(int limit) {
        return eventStore.findRecent(limit);
    }

    public List<WorkloadSample> getSamples(int limit) {
        return sampleStore.findRecent(limit);
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
