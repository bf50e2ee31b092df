package com.di.insightnova.alert;

import com.di.insightnova.insight.Urgency;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

public interface AlertStore {

    /**
     * Stores the alert unless one with the same source key exists.
     *
     * @return true when this call created it
     */
    boolean saveIfAbsent(Alert alert);

    boolean existsBySourceKey(String sourceKey);

    Optional<Alert> findById(String id);

    /** PENDING alerts not yet handed to the notification channel, oldest first. */
    List<Alert> findUndispatched(int limit);

    /**
     * Applies {@code change} atomically to the stored alert.
     *
     * @return the updated alert, empty when the id is unknown
     */
    Optional<Alert> update(String id, UnaryOperator<Alert> change);

    /** Newest first; {@code status} null means any. */
    List<Alert> findRecent(NotificationStatus status, int limit);

    /** Alerts triggered since {@code since}, of the given urgencies, not yet RESOLVED. */
    long countActiveSince(Instant since, Set<Urgency> urgencies);

    long countByStatus(NotificationStatus status);

    int deleteTriggeredBefore(Instant cutoff);
}
