package com.di.insightnova.scaling;

import org.springframework.stereotype.Component;

/**
 * Prices a capacity change. Scale-up benefit is the relative capacity gain capped at 50 %;
 * scale-down benefit is the relative loss, capped at 20 %, as a negative number.
 * ROI is benefit per unit of extra cost, or the benefit itself when the change saves money.
 */
@Component
public class CostBenefitCalculator {

    static final double MAX_SCALE_UP_BENEFIT = 50.0;
    static final double MAX_SCALE_DOWN_PENALTY = 20.0;

    public CostBenefit evaluate(int currentCapacity, int proposedCapacity, double unitCost) {
        int delta = proposedCapacity - currentCapacity;
        double costDelta = delta * unitCost;
        double relative = currentCapacity > 0 ? Math.abs(delta) * 100.0 / currentCapacity : MAX_SCALE_UP_BENEFIT;
        double benefit = delta > 0
                ? Math.min(MAX_SCALE_UP_BENEFIT, relative)
                : -Math.min(MAX_SCALE_DOWN_PENALTY, relative);
        double roi = costDelta > 0 ? benefit / costDelta : benefit;
        return CostBenefit.builder()
                .costDelta(costDelta)
                .benefit(benefit)
                .roi(roi)
                .recommendation(classify(costDelta, roi))
                .build();
    }

    static CostRecommendation classify(double costDelta, double roi) {
        if (costDelta <= 0) return CostRecommendation.COST_SAVING;
        if (roi > 10) return CostRecommendation.HIGHLY_RECOMMENDED;
        if (roi > 5) return CostRecommendation.RECOMMENDED;
        if (roi > 2) return CostRecommendation.CONSIDER;
        return CostRecommendation.NOT_RECOMMENDED;
    }
}
