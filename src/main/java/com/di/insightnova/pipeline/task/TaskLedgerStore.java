package com.di.insightnova.pipeline.task;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of {@link ProcessingTask} rows. Every state change is a conditional transition
 * performed atomically by the store; callers never read-then-write.
 */
public interface TaskLedgerStore {

    /** Inserts a PENDING row if none exists for (item, stage). */
    void insertIfAbsent(String itemId, ProcessingStage stage, int maxAttempts, Instant now);

    /**
     * Moves the row to PROCESSING and increments its attempt count when it is PENDING, RETRYING
     * or PROCESSING since before {@code staleBefore}, and attempts remain.
     *
     * @return true when this caller won the claim
     */
    boolean claim(String itemId, ProcessingStage stage, String workerId, Instant now, Instant staleBefore);

    /** PROCESSING → COMPLETED; false when the row was not PROCESSING. */
    boolean complete(String itemId, ProcessingStage stage, Instant now);

    /**
     * PROCESSING → RETRYING while attempts remain, else FAILED.
     *
     * @return the resulting status, empty when the row was not PROCESSING
     */
    Optional<TaskStatus> fail(String itemId, ProcessingStage stage, String reason, Instant now);

    /** PROCESSING → FAILED regardless of remaining attempts; false when the row was not PROCESSING. */
    boolean abandon(String itemId, ProcessingStage stage, String reason, Instant now);

    Optional<ProcessingTask> find(String itemId, ProcessingStage stage);

    List<ProcessingTask> findByItem(String itemId);

    /** Item ids whose row for {@code stage} is claimable, oldest first. */
    List<String> findClaimable(ProcessingStage stage, Instant staleBefore, int limit);

    /**
     * Marks stale PROCESSING rows of {@code stage} with no attempts left as FAILED.
     *
     * @return the rows that were failed
     */
    List<ProcessingTask> expireExhausted(ProcessingStage stage, String reason, Instant staleBefore, Instant now);

    Map<TaskStatus, Long> countByStatus();

    /** Mean seconds between start and completion of rows completed since {@code since}. */
    double averageCompletionSeconds(Instant since);

    int deleteByItems(Collection<String> itemIds);
}
