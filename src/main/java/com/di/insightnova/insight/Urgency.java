package com.di.insightnova.insight;

/**
 * Urgency bands shared by insights and alerts. Comparisons are strict: a score equal to a band's
 * lower threshold falls into the band below.
 */
public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** {@code >0.8} CRITICAL, {@code >0.6} HIGH, {@code >0.4} MEDIUM, else LOW. */
    public static Urgency fromScore(double score) {
        if (score > 0.8) return CRITICAL;
        if (score > 0.6) return HIGH;
        if (score > 0.4) return MEDIUM;
        return LOW;
    }

    /** Recommendation insights never reach CRITICAL: {@code >0.7} HIGH, {@code >0.5} MEDIUM, else LOW. */
    public static Urgency fromRecommendationScore(double score) {
        if (score > 0.7) return HIGH;
        if (score > 0.5) return MEDIUM;
        return LOW;
    }

    public boolean isAtLeast(Urgency other) {
        return compareTo(other) >= 0;
    }
}
