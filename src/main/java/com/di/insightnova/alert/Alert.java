package com.di.insightnova.alert;

import com.di.insightnova.insight.Urgency;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A significant event worth telling someone about. {@code sourceKey} is unique: the insight id
 * for insight alerts, {@code anomaly:<series>:<lastTimestamp>} for anomaly alerts.
 */
@Value
@Builder(toBuilder = true)
public class Alert {
    String id;
    String sourceKey;
    AlertSourceType sourceType;
    double significanceScore;
    Urgency urgency;
    String message;
    String personalizedMessage;
    String explanation;
    String recommendedAction;
    NotificationStatus notificationStatus;
    Instant triggeredAt;
    Instant dispatchedAt;
    Instant acknowledgedAt;
    Instant resolvedAt;
}
