package com.di.insightnova.insight;

public enum InsightType {
    CONTEXTUAL,
    PREDICTIVE,
    RECOMMENDATION,
    ALERT
}
