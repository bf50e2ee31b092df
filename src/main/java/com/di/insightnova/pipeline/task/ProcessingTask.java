package com.di.insightnova.pipeline.task;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Ledger row for one (item, stage). {@code attemptCount} counts claims and never exceeds
 * {@code maxAttempts}.
 */
@Value
@Builder(toBuilder = true)
public class ProcessingTask {
    String itemId;
    ProcessingStage stage;
    TaskStatus status;
    int attemptCount;
    int maxAttempts;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    String lastError;
    String assignedWorker;

    /** PROCESSING since before {@code staleBefore}: the worker is presumed dead. */
    public boolean isStale(Instant staleBefore) {
        return status == TaskStatus.PROCESSING && startedAt != null && startedAt.isBefore(staleBefore);
    }

    /** Whether a claim at this moment would succeed. */
    public boolean isClaimable(Instant staleBefore) {
        if (attemptCount >= maxAttempts) {
            return false;
        }
        return status == TaskStatus.PENDING || status == TaskStatus.RETRYING || isStale(staleBefore);
    }
}
