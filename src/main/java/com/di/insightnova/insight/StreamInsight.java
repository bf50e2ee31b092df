package com.di.insightnova.insight;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An insight derived from one stream event. Immutable once written; purged after {@code expiresAt}.
 */
@Value
@Builder
public class StreamInsight {
    String id;
    /** Id of the StreamEvent the insight was derived from. */
    String sourceItemId;
    InsightType type;
    String content;
    double confidence;
    Urgency urgency;
    String targetUsers;
    float[] embedding;
    Instant createdAt;
    Instant expiresAt;
    long processingTimeMs;
}
