package com.di.insightnova.recommendation;

import com.di.insightnova.ai.gateway.InferenceUnavailableException;
import com.di.insightnova.aspect.LogJob;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.exception.IllegalStatusTransitionException;
import com.di.insightnova.exception.ResourceNotFoundException;
import com.di.insightnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recommendation job, query API and user-context intake.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final ContextRecommender recommender;
    private final RecommendationStore recommendationStore;
    private final UserContextStore contextStore;
    private final PipelineProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * Refreshes recommendations for recently active users. Users whose recommendations are newer
     * than their context are skipped; one user's failure does not stop the others.
     *
     * @return number of users refreshed
     */
    public int refreshActiveUsers() {
        Instant now = clock.instant();
        int purged = recommendationStore.deleteExpired(now);
        if (purged > 0) {
            log.debug("[RECOMMEND] Purged {} expired recommendation(s)", purged);
        }

        List<UserContext> active = contextStore.findActive(now.minus(config().getActiveUserWindow()), now,
                config().getMaxUsersPerCycle());
        int refreshed = 0;
        for (UserContext context : active) {
            if (recommendationStore.hasFreshSince(context.getUserId(), context.getUpdatedAt(), now)) {
                continue;
            }
            try {
                List<Recommendation> recommendations = recommender.recommend(context);
                recommendationStore.saveAll(recommendations);
                metricsCollector.recordRecommendations(recommendations.size());
                refreshed++;
            } catch (InferenceUnavailableException e) {
                log.warn("[RECOMMEND] Inference unavailable for user {}, retrying next cycle: {}",
                        context.getUserId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("[RECOMMEND] Recommendation failed for user {}", context.getUserId(), e);
            }
        }
        log.info("[RECOMMEND] {} active user(s), {} refreshed", active.size(), refreshed);
        return refreshed;
    }

    /**
     * @param types empty or null means every type
     */
    public List<Recommendation> getRecommendations(String userId, Set<RecommendationType> types, Integer limit) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        Set<RecommendationType> wanted = types == null || types.isEmpty()
                ? EnumSet.allOf(RecommendationType.class) : EnumSet.copyOf(types);
        int max = limit == null ? config().getDefaultQueryLimit() : limit;
        if (max <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return recommendationStore.findActive(userId, wanted, clock.instant(), max);
    }

    @LogJob(eventType = "RECOMMENDATION_STATUS", operation = "interaction_status_update",
            parameterNames = {"recommendationId", "status"})
    public Recommendation updateStatus(String recommendationId, InteractionStatus status) {
        Instant now = clock.instant();
        return recommendationStore.update(recommendationId, current -> {
            if (current.getInteractionStatus() == status) {
                return current;
            }
            if (!current.getInteractionStatus().canMoveTo(status)) {
                throw new IllegalStatusTransitionException("recommendation", recommendationId,
                        current.getInteractionStatus(), status);
            }
            return current.toBuilder().interactionStatus(status).statusUpdatedAt(now).build();
        }).orElseThrow(() -> new ResourceNotFoundException("recommendation", recommendationId));
    }

    @LogJob(eventType = "USER_CONTEXT", operation = "context_upsert", parameterNames = {"userId"})
    public UserContext upsertContext(String userId, UserContextRequest request) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        Instant now = clock.instant();
        UserContext context = UserContext.builder()
                .userId(userId)
                .role(request.getRole())
                .activeProjects(copy(request.getActiveProjects()))
                .recentQueries(copy(request.getRecentQueries()))
                .discussionContext(request.getDiscussionContext())
                .constraints(copy(request.getConstraints()))
                .updatedAt(now)
                .expiresAt(now.plus(config().getContextTtl()))
                .build();
        contextStore.upsert(context);
        log.info("[RECOMMEND] Context updated for user {} (role={})", userId, context.getRole());
        return context;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of()
                : values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    private PipelineProperties.RecommendationConfig config() {
        return properties.getRecommendations();
    }
}
