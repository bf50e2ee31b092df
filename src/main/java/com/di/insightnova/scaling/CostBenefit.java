package com.di.insightnova.scaling;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CostBenefit {
    /** Cost change per hour; negative for a scale-down. */
    double costDelta;
    /** Expected performance change in percent; negative for a scale-down. */
    double benefit;
    double roi;
    CostRecommendation recommendation;
}
