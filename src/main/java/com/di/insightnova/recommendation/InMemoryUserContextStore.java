package com.di.insightnova.recommendation;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryUserContextStore implements UserContextStore {

    private final Map<String, UserContext> contexts = new ConcurrentHashMap<>();

    @Override
    public void upsert(UserContext context) {
        contexts.put(context.getUserId(), context);
    }

    @Override
    public Optional<UserContext> find(String userId) {
        return Optional.ofNullable(contexts.get(userId));
    }

    @Override
    public List<UserContext> findActive(Instant since, Instant now, int limit) {
        return contexts.values().stream()
                .filter(c -> !c.getUpdatedAt().isBefore(since))
                .filter(c -> c.getExpiresAt().isAfter(now))
                .sorted(Comparator.comparing(UserContext::getUpdatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteExpired(Instant now) {
        int before = contexts.size();
        contexts.values().removeIf(c -> !c.getExpiresAt().isAfter(now));
        return Math.max(0, before - contexts.size());
    }
}
