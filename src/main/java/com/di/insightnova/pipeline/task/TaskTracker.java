package com.di.insightnova.pipeline.task;

import com.di.insightnova.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-(item, stage) work ledger and the only synchronization primitive between concurrent
 * workers. A claim is an atomic conditional transition that also counts the attempt, so an item
 * is processed by at most one worker at a time and at most {@code maxAttempts} times per stage.
 */
@Slf4j
@Service
public class TaskTracker {

    static final String TIMEOUT_REASON = "timeout";

    private final TaskLedgerStore store;
    private final PipelineProperties.TaskConfig config;
    private final Clock clock;
    private final String workerId;

    public TaskTracker(TaskLedgerStore store, PipelineProperties properties, Clock clock) {
        this.store = store;
        this.config = properties.getTasks();
        this.clock = clock;
        this.workerId = ManagementFactory.getRuntimeMXBean().getName() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Claims (item, stage) for this worker, creating the row when absent.
     *
     * @return true when the caller may run the stage
     */
    public boolean claim(String itemId, ProcessingStage stage) {
        Instant now = clock.instant();
        store.insertIfAbsent(itemId, stage, config.getMaxAttempts(), now);
        boolean claimed = store.claim(itemId, stage, workerId, now, staleBefore(now));
        if (!claimed) {
            log.debug("[TASK] Claim refused for {}/{}", itemId, stage);
        }
        return claimed;
    }

    /** Completes a claimed task; repeated calls are no-ops. */
    public void complete(String itemId, ProcessingStage stage) {
        if (!store.complete(itemId, stage, clock.instant())) {
            log.debug("[TASK] Complete ignored for {}/{} (not processing)", itemId, stage);
        }
    }

    /**
     * Records a failed attempt.
     *
     * @return RETRYING while attempts remain, FAILED once they are exhausted
     */
    public TaskStatus fail(String itemId, ProcessingStage stage, String reason) {
        Optional<TaskStatus> next = store.fail(itemId, stage, reason, clock.instant());
        if (next.isEmpty()) {
            log.warn("[TASK] Fail ignored for {}/{} (not processing)", itemId, stage);
            return store.find(itemId, stage).map(ProcessingTask::getStatus).orElse(TaskStatus.FAILED);
        }
        return next.get();
    }

    /** Fails a claimed task for good, whatever attempts remain. */
    public void abandon(String itemId, ProcessingStage stage, String reason) {
        if (store.abandon(itemId, stage, reason, clock.instant())) {
            log.warn("[TASK] Abandoned {}/{}: {}", itemId, stage, reason);
        } else {
            log.debug("[TASK] Abandon ignored for {}/{} (not processing)", itemId, stage);
        }
    }

    public void enqueue(String itemId, ProcessingStage stage) {
        store.insertIfAbsent(itemId, stage, config.getMaxAttempts(), clock.instant());
    }

    /**
     * Fails stuck PROCESSING rows of {@code stage} that have no attempts left. Stuck rows with
     * attempts left stay reclaimable.
     */
    public List<ProcessingTask> expireStale(ProcessingStage stage) {
        Instant now = clock.instant();
        List<ProcessingTask> expired = store.expireExhausted(stage, TIMEOUT_REASON, staleBefore(now), now);
        if (!expired.isEmpty()) {
            log.warn("[TASK] Expired {} stuck {} task(s) with no attempts left", expired.size(), stage);
        }
        return expired;
    }

    public List<String> findClaimable(ProcessingStage stage, int limit) {
        return store.findClaimable(stage, staleBefore(clock.instant()), limit);
    }

    public Optional<ProcessingTask> find(String itemId, ProcessingStage stage) {
        return store.find(itemId, stage);
    }

    public List<ProcessingTask> findByItem(String itemId) {
        return store.findByItem(itemId);
    }

    public Map<TaskStatus, Long> counts() {
        return store.countByStatus();
    }

    public double averageCompletionSeconds(Instant since) {
        return store.averageCompletionSeconds(since);
    }

    public int forget(Collection<String> itemIds) {
        return store.deleteByItems(itemIds);
    }

    public int getMaxAttempts() {
        return config.getMaxAttempts();
    }

    private Instant staleBefore(Instant now) {
        return now.minus(config.getTimeout());
    }
}
