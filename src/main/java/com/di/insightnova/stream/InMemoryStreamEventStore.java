package com.di.insightnova.stream;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryStreamEventStore implements StreamEventStore {

    private final Map<String, StreamEvent> byStagedItem = new ConcurrentHashMap<>();
    private final Map<String, StreamEvent> byId = new ConcurrentHashMap<>();

    @Override
    public StreamEvent publishIfAbsent(StreamEvent event) {
        StreamEvent stored = byStagedItem.computeIfAbsent(event.getStagedItemId(), k -> event);
        byId.putIfAbsent(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<StreamEvent> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<StreamEvent> findByStagedItemId(String stagedItemId) {
        StreamEvent event = byStagedItem.get(stagedItemId);
        return event == null ? Optional.empty() : findById(event.getId());
    }

    @Override
    public boolean updateStatus(String id, StreamEventStatus status, Instant now) {
        StreamEvent updated = byId.computeIfPresent(id, (k, current) -> current.toBuilder()
                .status(status)
                .completedAt(status == StreamEventStatus.COMPLETED || status == StreamEventStatus.FAILED ? now : null)
                .build());
        if (updated == null) {
            return false;
        }
        byStagedItem.put(updated.getStagedItemId(), updated);
        return true;
    }

    @Override
    public List<StreamEvent> findCompletedSince(Instant since, String excludeId, int limit) {
        return byId.values().stream()
                .filter(e -> e.getStatus() == StreamEventStatus.COMPLETED)
                .filter(e -> e.getCompletedAt() != null && !e.getCompletedAt().isBefore(since))
                .filter(e -> !e.getId().equals(excludeId))
                .sorted(Comparator.comparing(StreamEvent::getCompletedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public long countByStatus(StreamEventStatus status) {
        return byId.values().stream().filter(e -> e.getStatus() == status).count();
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        int removed = 0;
        for (StreamEvent e : List.copyOf(byId.values())) {
            boolean finished = e.getStatus() == StreamEventStatus.COMPLETED || e.getStatus() == StreamEventStatus.FAILED;
            if (finished && e.getPublishedAt().isBefore(cutoff) && byId.remove(e.getId(), e)) {
                byStagedItem.remove(e.getStagedItemId());
                removed++;
            }
        }
        return removed;
    }
}
