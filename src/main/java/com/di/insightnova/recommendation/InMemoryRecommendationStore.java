package com.di.insightnova.recommendation;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Component
public class InMemoryRecommendationStore implements RecommendationStore {

    private static final Comparator<Recommendation> RANKING = Comparator
            .comparingDouble(Recommendation::getPriority).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::getConfidence).reversed());

    private final Map<String, Recommendation> recommendations = new ConcurrentHashMap<>();

    @Override
    public void saveAll(Collection<Recommendation> batch) {
        batch.forEach(r -> recommendations.put(r.getId(), r));
    }

    @Override
    public Optional<Recommendation> findById(String id) {
        return Optional.ofNullable(recommendations.get(id));
    }

    @Override
    public List<Recommendation> findActive(String userId, Set<RecommendationType> types, Instant now, int limit) {
        return recommendations.values().stream()
                .filter(r -> r.getUserId().equals(userId))
                .filter(r -> types.contains(r.getType()))
                .filter(r -> r.isFresh(now))
                .filter(r -> r.getInteractionStatus() == InteractionStatus.PENDING
                        || r.getInteractionStatus() == InteractionStatus.VIEWED)
                .sorted(RANKING)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasFreshSince(String userId, Instant since, Instant now) {
        return recommendations.values().stream()
                .anyMatch(r -> r.getUserId().equals(userId) && !r.getCreatedAt().isBefore(since) && r.isFresh(now));
    }

    @Override
    public Optional<Recommendation> update(String id, UnaryOperator<Recommendation> change) {
        return Optional.ofNullable(recommendations.computeIfPresent(id, (k, current) -> change.apply(current)));
    }

    @Override
    public int deleteExpired(Instant now) {
        int before = recommendations.size();
        recommendations.values().removeIf(r -> !r.isFresh(now));
        return Math.max(0, before - recommendations.size());
    }
}
