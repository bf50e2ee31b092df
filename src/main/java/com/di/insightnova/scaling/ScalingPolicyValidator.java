package com.di.insightnova.scaling;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ScalingPolicyValidator {

    /**
     * @throws PolicyValidationException listing every violated rule
     */
    public void validate(ScalingPolicy p) {
        List<String> violations = new ArrayList<>();
        if (p.getMinCapacity() < 0) {
            violations.add("minCapacity must be >= 0");
        }
        if (p.getMinCapacity() > p.getMaxCapacity()) {
            violations.add("minCapacity must be <= maxCapacity");
        }
        if (p.getCurrentCapacity() < p.getMinCapacity() || p.getCurrentCapacity() > p.getMaxCapacity()) {
            violations.add("currentCapacity must be within [minCapacity, maxCapacity]");
        }
        if (p.getScaleDownThreshold() < 0) {
            violations.add("scaleDownThreshold must be >= 0");
        }
        if (p.getScaleDownThreshold() >= p.getScaleUpThreshold()) {
            violations.add("scaleDownThreshold must be < scaleUpThreshold");
        }
        if (p.getScaleUpIncrement() <= 0) {
            violations.add("scaleUpIncrement must be > 0");
        }
        if (p.getScaleDownIncrement() <= 0) {
            violations.add("scaleDownIncrement must be > 0");
        }
        if (p.getCooldown() == null || p.getCooldown().isNegative()) {
            violations.add("cooldown must be >= 0");
        }
        if (p.getUnitCost() < 0) {
            violations.add("unitCost must be >= 0");
        }
        if (!violations.isEmpty()) {
            throw new PolicyValidationException(p.getResourceType(), violations);
        }
    }
}
