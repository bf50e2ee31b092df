package com.di.insightnova.stream;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface StreamEventStore {

    /**
     * Publishes {@code event} unless one already exists for its staged item.
     *
     * @return the stored event: the given one, or the one published earlier
     */
    StreamEvent publishIfAbsent(StreamEvent event);

    Optional<StreamEvent> findById(String id);

    Optional<StreamEvent> findByStagedItemId(String stagedItemId);

    boolean updateStatus(String id, StreamEventStatus status, Instant now);

    /** COMPLETED events finished at or after {@code since}, newest first, excluding {@code excludeId}. */
    List<StreamEvent> findCompletedSince(Instant since, String excludeId, int limit);

    long countByStatus(StreamEventStatus status);

    /** Deletes COMPLETED and FAILED events published before {@code cutoff}. */
    int deleteFinishedBefore(Instant cutoff);
}
