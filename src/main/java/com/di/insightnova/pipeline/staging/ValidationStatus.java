package com.di.insightnova.pipeline.staging;

/**
 * Lifecycle of a staged item. PENDING is left at most once and never re-entered.
 */
public enum ValidationStatus {
    PENDING,
    VALID,
    INVALID,
    NEEDS_REVIEW;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
