package com.di.insightnova.insight;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryInsightStore implements InsightStore {

    private final Map<String, StreamInsight> insights = new ConcurrentHashMap<>();

    @Override
    public void saveAll(Collection<StreamInsight> batch) {
        batch.forEach(i -> insights.putIfAbsent(i.getId(), i));
    }

    @Override
    public Optional<StreamInsight> findById(String id) {
        return Optional.ofNullable(insights.get(id));
    }

    @Override
    public List<StreamInsight> findConfidentSince(Instant since, double minConfidence) {
        return insights.values().stream()
                .filter(i -> !i.getCreatedAt().isBefore(since) && i.getConfidence() > minConfidence)
                .sorted(Comparator.comparingDouble(StreamInsight::getConfidence).reversed()
                        .thenComparing(StreamInsight::getCreatedAt, Comparator.reverseOrder()))
                .collect(Collectors.toList());
    }

    @Override
    public List<StreamInsight> findForUser(String userId, String everyone, Set<InsightType> types, Instant since,
                                           int limit) {
        return insights.values().stream()
                .filter(i -> types.contains(i.getType()))
                .filter(i -> everyone.equals(i.getTargetUsers()) || userId.equals(i.getTargetUsers()))
                .filter(i -> !i.getCreatedAt().isBefore(since))
                .sorted(Comparator.comparing(StreamInsight::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<StreamInsight> findBySourceItem(String sourceItemId) {
        return insights.values().stream()
                .filter(i -> sourceItemId.equals(i.getSourceItemId()))
                .sorted(Comparator.comparing(StreamInsight::getType))
                .collect(Collectors.toList());
    }

    @Override
    public long countCreatedSince(Instant since) {
        return insights.values().stream().filter(i -> !i.getCreatedAt().isBefore(since)).count();
    }

    @Override
    public int deleteExpired(Instant now) {
        int before = insights.size();
        insights.values().removeIf(i -> !i.getExpiresAt().isAfter(now));
        return before - insights.size();
    }
}
