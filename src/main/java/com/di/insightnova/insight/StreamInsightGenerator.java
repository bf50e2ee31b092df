package com.di.insightnova.insight;

import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.stream.StreamEvent;
import com.di.insightnova.stream.StreamEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns one stream event into a contextual insight and a recommendation insight, using the
 * recently completed events as context.
 *
 * <p>The contextual insight carries the significance score as its confidence; with no history
 * (cold start) that confidence is capped. The recommendation insight is always less confident
 * (0.9× the contextual confidence) and is banded on its own scale.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamInsightGenerator {

    static final double RECOMMENDATION_CONFIDENCE_FACTOR = 0.9;

    private final InferenceGateway gateway;
    private final StreamEventStore streamEventStore;
    private final PipelineProperties properties;
    private final Clock clock;

    public List<StreamInsight> process(StreamEvent event) {
        long start = System.currentTimeMillis();
        Instant now = clock.instant();
        List<StreamEvent> history = streamEventStore.findCompletedSince(
                now.minus(config().getHistoryWindow()), event.getId(), config().getHistoryLimit());
        String historyText = history.isEmpty()
                ? "(no recent activity)"
                : history.stream().map(e -> "- " + e.getContent()).collect(Collectors.joining("\n"));

        String contextual = gateway.generate(String.format("""
                Analyze this real-time data in the context of recent activity.
                Current data: %s
                Recent activity:
                %s
                Provide a concise business insight.
                """, event.getContent(), historyText));

        double score = clamp(gateway.generateDouble(String.format("""
                Rate the business significance of this insight from 0.0 to 1.0.
                Insight: %s
                Source data: %s
                """, contextual, event.getContent())));

        String recommendation = gateway.generate(String.format("""
                Based on this insight, provide specific actionable recommendations.
                Insight: %s
                Source data: %s
                """, contextual, event.getContent()));

        boolean coldStart = history.isEmpty();
        double confidence = coldStart ? Math.min(score, config().getColdStartConfidenceCap()) : score;
        long processingMs = System.currentTimeMillis() - start;
        Instant expiresAt = now.plus(config().getInsightTtl());

        StreamInsight contextualInsight = StreamInsight.builder()
                .id(UUID.randomUUID().toString())
                .sourceItemId(event.getId())
                .type(InsightType.CONTEXTUAL)
                .content(contextual)
                .confidence(confidence)
                .urgency(Urgency.fromScore(score))
                .targetUsers(config().getDefaultTargetUsers())
                .embedding(event.getEmbedding())
                .createdAt(now)
                .expiresAt(expiresAt)
                .processingTimeMs(processingMs)
                .build();

        StreamInsight recommendationInsight = StreamInsight.builder()
                .id(UUID.randomUUID().toString())
                .sourceItemId(event.getId())
                .type(InsightType.RECOMMENDATION)
                .content(recommendation)
                .confidence(RECOMMENDATION_CONFIDENCE_FACTOR * confidence)
                .urgency(Urgency.fromRecommendationScore(score))
                .targetUsers(config().getDefaultTargetUsers())
                .embedding(event.getEmbedding())
                .createdAt(now)
                .expiresAt(expiresAt)
                .processingTimeMs(processingMs)
                .build();

        log.debug("[INSIGHT] event={} score={} coldStart={} history={}", event.getId(), score, coldStart, history.size());
        return List.of(contextualInsight, recommendationInsight);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private PipelineProperties.StreamConfig config() {
        return properties.getStream();
    }
}
