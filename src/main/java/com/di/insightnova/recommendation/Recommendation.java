package com.di.insightnova.recommendation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class Recommendation {
    String id;
    String userId;
    RecommendationType type;
    String title;
    String content;
    double priority;
    double confidence;
    @Singular("evidence")
    List<String> supportingEvidence;
    Instant createdAt;
    Instant expiresAt;
    InteractionStatus interactionStatus;
    Instant statusUpdatedAt;

    public boolean isFresh(Instant now) {
        return expiresAt.isAfter(now);
    }
}
