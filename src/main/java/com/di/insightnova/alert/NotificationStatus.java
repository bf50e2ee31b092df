package com.di.insightnova.alert;

/**
 * Delivery lifecycle of an alert. Moves forward only: PENDING → SENT → ACKNOWLEDGED → RESOLVED
 * (steps may be skipped).
 */
public enum NotificationStatus {
    PENDING,
    SENT,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean canMoveTo(NotificationStatus next) {
        return next.ordinal() > ordinal();
    }
}
