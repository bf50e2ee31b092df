package com.di.insightnova.alert;

import com.di.insightnova.insight.Urgency;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory alert store. The source-key index is the uniqueness constraint: only the caller
 * whose {@code putIfAbsent} wins creates the alert.
 */
@Component
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, String> idBySourceKey = new ConcurrentHashMap<>();
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public boolean saveIfAbsent(Alert alert) {
        if (idBySourceKey.putIfAbsent(alert.getSourceKey(), alert.getId()) != null) {
            return false;
        }
        alerts.put(alert.getId(), alert);
        return true;
    }

    @Override
    public boolean existsBySourceKey(String sourceKey) {
        return idBySourceKey.containsKey(sourceKey);
    }

    @Override
    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(alerts.get(id));
    }

    @Override
    public List<Alert> findUndispatched(int limit) {
        return alerts.values().stream()
                .filter(a -> a.getNotificationStatus() == NotificationStatus.PENDING && a.getDispatchedAt() == null)
                .sorted(Comparator.comparing(Alert::getTriggeredAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Alert> update(String id, UnaryOperator<Alert> change) {
        return Optional.ofNullable(alerts.computeIfPresent(id, (k, current) -> change.apply(current)));
    }

    @Override
    public List<Alert> findRecent(NotificationStatus status, int limit) {
        return alerts.values().stream()
                .filter(a -> status == null || a.getNotificationStatus() == status)
                .sorted(Comparator.comparing(Alert::getTriggeredAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public long countActiveSince(Instant since, Set<Urgency> urgencies) {
        return alerts.values().stream()
                .filter(a -> !a.getTriggeredAt().isBefore(since))
                .filter(a -> urgencies.contains(a.getUrgency()))
                .filter(a -> a.getNotificationStatus() != NotificationStatus.RESOLVED)
                .count();
    }

    @Override
    public long countByStatus(NotificationStatus status) {
        return alerts.values().stream().filter(a -> a.getNotificationStatus() == status).count();
    }

    @Override
    public int deleteTriggeredBefore(Instant cutoff) {
        int removed = 0;
        for (Alert a : List.copyOf(alerts.values())) {
            if (a.getTriggeredAt().isBefore(cutoff) && alerts.remove(a.getId(), a)) {
                idBySourceKey.remove(a.getSourceKey(), a.getId());
                removed++;
            }
        }
        return removed;
    }
}
