package com.di.insightnova.scaling;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

/**
 * Threshold rules of the scaling controller. With a fresh forecast: up when the load or the
 * forecast exceeds the up threshold, down when both are under the down threshold. Without one
 * (missing, failed, or the sample is older than two sampling intervals) only the current load is
 * used and both thresholds are widened by the hysteresis margin.
 */
@Component
@RequiredArgsConstructor
public class ScalingDecisionEngine {

    private final ScalingProperties properties;

    public ScalingDecision decide(ScalingPolicy policy, WorkloadSample sample, Instant now) {
        ScalingDecision.ScalingDecisionBuilder builder = ScalingDecision.builder()
                .resourceType(policy.getResourceType())
                .currentCapacity(policy.getCurrentCapacity())
                .targetCapacity(policy.getCurrentCapacity());
        if (sample == null) {
            return builder.action(ScalingAction.MAINTAIN)
                    .upThreshold(policy.getScaleUpThreshold())
                    .downThreshold(policy.getScaleDownThreshold())
                    .rationale("no workload sample")
                    .build();
        }

        double load = sample.getSystemLoadPct();
        boolean stale = sample.getSampledAt().isBefore(now.minus(properties.getSamplingInterval().multipliedBy(2)));
        boolean useForecast = !stale && sample.isForecastAvailable() && sample.getPredictedLoad() != null;

        double up = policy.getScaleUpThreshold();
        double down = policy.getScaleDownThreshold();
        ScalingAction action;
        String reason;
        if (useForecast) {
            double forecast = sample.getPredictedLoad();
            builder.forecast(forecast);
            if (load > up || forecast > up) {
                action = ScalingAction.SCALE_UP;
                reason = String.format(Locale.ROOT, "load %.1f / forecast %.1f above %.1f", load, forecast, up);
            } else if (load < down && forecast < down) {
                action = ScalingAction.SCALE_DOWN;
                reason = String.format(Locale.ROOT, "load %.1f and forecast %.1f below %.1f", load, forecast, down);
            } else {
                action = ScalingAction.MAINTAIN;
                reason = String.format(Locale.ROOT, "load %.1f / forecast %.1f within [%.1f, %.1f]", load, forecast, down, up);
            }
        } else {
            up += properties.getHysteresisMargin();
            down -= properties.getHysteresisMargin();
            String why = stale ? "stale sample" : "no forecast";
            if (load > up) {
                action = ScalingAction.SCALE_UP;
                reason = String.format(Locale.ROOT, "%s; load %.1f above widened %.1f", why, load, up);
            } else if (load < down) {
                action = ScalingAction.SCALE_DOWN;
                reason = String.format(Locale.ROOT, "%s; load %.1f below widened %.1f", why, load, down);
            } else {
                action = ScalingAction.MAINTAIN;
                reason = String.format(Locale.ROOT, "%s; load %.1f within widened [%.1f, %.1f]", why, load, down, up);
            }
        }
        builder.load(load).upThreshold(up).downThreshold(down);

        int target = targetCapacity(policy, action);
        if (action != ScalingAction.MAINTAIN && target == policy.getCurrentCapacity()) {
            return builder.action(ScalingAction.MAINTAIN)
                    .rationale(reason + "; already at " + (action == ScalingAction.SCALE_UP ? "max" : "min") + " capacity")
                    .build();
        }
        return builder.action(action).targetCapacity(target).rationale(reason).build();
    }

    static int targetCapacity(ScalingPolicy policy, ScalingAction action) {
        int current = policy.getCurrentCapacity();
        switch (action) {
            case SCALE_UP:
                return Math.min(policy.getMaxCapacity(), current + policy.getScaleUpIncrement());
            case SCALE_DOWN:
                return Math.max(policy.getMinCapacity(), current - policy.getScaleDownIncrement());
            default:
                return current;
        }
    }
}
