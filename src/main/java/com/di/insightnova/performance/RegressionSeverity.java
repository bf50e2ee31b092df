package com.di.insightnova.performance;

/**
 * How far a value sits above its baseline, and what to do about it.
 */
public enum RegressionSeverity {
    NONE("NO_ACTION_NEEDED"),
    MINOR("MONITOR_CLOSELY"),
    MODERATE("SCHEDULE_OPTIMIZATION"),
    SEVERE("IMMEDIATE_OPTIMIZATION_REQUIRED");

    private final String recommendation;

    RegressionSeverity(String recommendation) {
        this.recommendation = recommendation;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
