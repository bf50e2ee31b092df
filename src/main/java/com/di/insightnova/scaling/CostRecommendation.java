package com.di.insightnova.scaling;

public enum CostRecommendation {
    HIGHLY_RECOMMENDED,
    RECOMMENDED,
    CONSIDER,
    COST_SAVING,
    NOT_RECOMMENDED
}
