package com.di.insightnova.recommendation;

import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.ai.gateway.InferenceUnavailableException;
import com.di.insightnova.ai.gateway.ResponseParsers;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.insight.InsightStore;
import com.di.insightnova.insight.InsightType;
import com.di.insightnova.insight.StreamInsight;
import com.di.insightnova.util.Vectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds one recommendation per {@link RecommendationType} for a user's current situation,
 * grounded in the most similar past insights.
 *
 * <p>Similar insights are CONTEXTUAL or RECOMMENDATION insights aimed at the user or at everyone,
 * ranked by cosine similarity to the situation embedding. When the situation cannot be embedded,
 * or an insight has no embedding, recency decides.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextRecommender {

    private static final Set<InsightType> HISTORY_TYPES = EnumSet.of(InsightType.CONTEXTUAL, InsightType.RECOMMENDATION);
    private static final int CANDIDATE_POOL = 200;
    private static final String NONE = "none available";

    private final InferenceGateway gateway;
    private final InsightStore insightStore;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * @throws InferenceUnavailableException when any content, priority or evidence call fails;
     *                                       nothing is returned partially
     */
    public List<Recommendation> recommend(UserContext context) {
        Instant now = clock.instant();
        String situation = context.situation();
        List<StreamInsight> similar = similarInsights(context.getUserId(), situation, now);

        String patterns = NONE;
        String pastDecisions = NONE;
        if (!similar.isEmpty()) {
            String history = similar.stream().map(StreamInsight::getContent).collect(Collectors.joining("; "));
            patterns = gateway.generate(String.format("""
                    Find patterns and similarities between current context: "%s" and these historical contexts: %s.
                    Identify recurring themes, successful approaches, and lessons learned.
                    """, situation, history));
            pastDecisions = gateway.generate(String.format("""
                    Extract key decision points and outcomes from historical contexts: %s.
                    Focus on actionable insights and successful strategies.
                    """, similar.stream().limit(5)
                    .map(i -> i.getContent() + String.format(Locale.ROOT, " (confidence: %.2f)", i.getConfidence()))
                    .collect(Collectors.joining("; "))));
        }

        String projects = join(context.getActiveProjects());
        String constraints = join(context.getConstraints());

        String actions = gateway.generate(String.format("""
                Based on this discussion context: "%s" and user context: %s, generate 3 specific action item recommendations.
                Historical similar situations: %s.
                Format as numbered list with clear next steps.
                """, situation, projects, patterns));
        String information = gateway.generate(String.format("""
                Identify relevant information this user should know given context: "%s" and their role: %s.
                Historical patterns: %s.
                Suggest specific documents, data, or insights they should review.
                """, situation, context.getRole(), patterns));
        String decisions = gateway.generate(String.format("""
                Provide decision support recommendations for: "%s".
                Consider past decisions: %s, current constraints: %s.
                Suggest decision frameworks and key factors to consider.
                """, situation, pastDecisions, constraints));

        double actionPriority = score(String.format(
                "Rate the urgency of action items from 0.0 to 1.0 for context: \"%s\"", situation));
        double infoPriority = score(String.format(
                "Rate the importance of information sharing from 0.0 to 1.0 for context: \"%s\"", situation));
        double decisionPriority = score(String.format(
                "Rate the criticality of decision support from 0.0 to 1.0 for context: \"%s\"", situation));

        List<String> evidence = ResponseParsers.splitLines(gateway.generate(String.format("""
                Extract 3 key pieces of supporting evidence from historical data: %s
                that support recommendations for context: "%s". One per line.
                """, similar.isEmpty() ? NONE : similar.stream().limit(5).map(StreamInsight::getContent)
                .collect(Collectors.joining(" | ")), situation)));

        Instant expiresAt = now.plus(properties.getRecommendations().getTtl());
        List<Recommendation> out = new ArrayList<>(3);
        out.add(build(context.getUserId(), RecommendationType.ACTION_ITEM, actions, actionPriority, evidence, now, expiresAt));
        out.add(build(context.getUserId(), RecommendationType.INFORMATION, information, infoPriority, evidence, now, expiresAt));
        out.add(build(context.getUserId(), RecommendationType.DECISION_SUPPORT, decisions, decisionPriority, evidence, now, expiresAt));
        return out;
    }

    List<StreamInsight> similarInsights(String userId, String situation, Instant now) {
        PipelineProperties.RecommendationConfig config = properties.getRecommendations();
        List<StreamInsight> pool = insightStore.findForUser(userId, properties.getStream().getDefaultTargetUsers(),
                HISTORY_TYPES, now.minus(config.getInsightLookback()), CANDIDATE_POOL);
        if (pool.isEmpty()) {
            return pool;
        }

        float[] query = null;
        if (!situation.isBlank()) {
            try {
                query = gateway.generateEmbedding(situation);
            } catch (InferenceUnavailableException e) {
                log.debug("[RECOMMEND] Situation embedding unavailable, ranking by recency: {}", e.getMessage());
            }
        }
        if (!Vectors.isPresent(query)) {
            return pool.stream().limit(config.getSimilarInsights()).collect(Collectors.toList());
        }

        float[] q = query;
        // Pool is newest first; the stable sort keeps that order among equal scores.
        return pool.stream()
                .sorted(Comparator.comparingDouble((StreamInsight i) ->
                        Vectors.isPresent(i.getEmbedding()) ? Vectors.cosine(q, i.getEmbedding()) : -2.0).reversed())
                .limit(config.getSimilarInsights())
                .collect(Collectors.toList());
    }

    private double score(String prompt) {
        double v = gateway.generateDouble(prompt);
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static Recommendation build(String userId, RecommendationType type, String content, double priority,
                                        List<String> evidence, Instant now, Instant expiresAt) {
        return Recommendation.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .type(type)
                .title(type.getTitle())
                .content(content)
                .priority(priority)
                .confidence(type.getConfidence())
                .supportingEvidence(evidence)
                .createdAt(now)
                .expiresAt(expiresAt)
                .interactionStatus(InteractionStatus.PENDING)
                .statusUpdatedAt(now)
                .build();
    }

    private static String join(List<String> values) {
        return values == null || values.isEmpty() ? NONE : String.join(", ", values);
    }
}
