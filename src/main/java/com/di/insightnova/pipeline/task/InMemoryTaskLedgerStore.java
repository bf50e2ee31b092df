package com.di.insightnova.pipeline.task;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory task ledger. Each transition runs inside {@link ConcurrentHashMap#compute}, which is
 * atomic per key, so two workers racing on the same (item, stage) cannot both win a claim.
 * When insightnova.persistence.jdbc-enabled=true, JdbcTaskLedgerStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryTaskLedgerStore implements TaskLedgerStore {

    private final Map<TaskKey, ProcessingTask> tasks = new ConcurrentHashMap<>();

    @Override
    public void insertIfAbsent(String itemId, ProcessingStage stage, int maxAttempts, Instant now) {
        tasks.computeIfAbsent(new TaskKey(itemId, stage), k -> pending(itemId, stage, maxAttempts, now));
    }

    @Override
    public boolean claim(String itemId, ProcessingStage stage, String workerId, Instant now, Instant staleBefore) {
        boolean[] won = {false};
        tasks.compute(new TaskKey(itemId, stage), (k, current) -> {
            if (current == null || !current.isClaimable(staleBefore)) {
                return current;
            }
            won[0] = true;
            return current.toBuilder()
                    .status(TaskStatus.PROCESSING)
                    .attemptCount(current.getAttemptCount() + 1)
                    .startedAt(now)
                    .completedAt(null)
                    .assignedWorker(workerId)
                    .build();
        });
        return won[0];
    }

    @Override
    public boolean complete(String itemId, ProcessingStage stage, Instant now) {
        boolean[] changed = {false};
        tasks.computeIfPresent(new TaskKey(itemId, stage), (k, current) -> {
            if (current.getStatus() != TaskStatus.PROCESSING) {
                return current;
            }
            changed[0] = true;
            return current.toBuilder().status(TaskStatus.COMPLETED).completedAt(now).build();
        });
        return changed[0];
    }

    @Override
    public Optional<TaskStatus> fail(String itemId, ProcessingStage stage, String reason, Instant now) {
        TaskStatus[] result = {null};
        tasks.computeIfPresent(new TaskKey(itemId, stage), (k, current) -> {
            if (current.getStatus() != TaskStatus.PROCESSING) {
                return current;
            }
            TaskStatus next = current.getAttemptCount() < current.getMaxAttempts()
                    ? TaskStatus.RETRYING : TaskStatus.FAILED;
            result[0] = next;
            return current.toBuilder()
                    .status(next)
                    .lastError(reason)
                    .completedAt(next == TaskStatus.FAILED ? now : null)
                    .build();
        });
        return Optional.ofNullable(result[0]);
    }

    @Override
    public boolean abandon(String itemId, ProcessingStage stage, String reason, Instant now) {
        boolean[] changed = {false};
        tasks.computeIfPresent(new TaskKey(itemId, stage), (k, current) -> {
            if (current.getStatus() != TaskStatus.PROCESSING) {
                return current;
            }
            changed[0] = true;
            return current.toBuilder().status(TaskStatus.FAILED).lastError(reason).completedAt(now).build();
        });
        return changed[0];
    }

    @Override
    public Optional<ProcessingTask> find(String itemId, ProcessingStage stage) {
        return Optional.ofNullable(tasks.get(new TaskKey(itemId, stage)));
    }

    @Override
    public List<ProcessingTask> findByItem(String itemId) {
        return tasks.values().stream()
                .filter(t -> t.getItemId().equals(itemId))
                .sorted(Comparator.comparing(ProcessingTask::getStage))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findClaimable(ProcessingStage stage, Instant staleBefore, int limit) {
        return tasks.values().stream()
                .filter(t -> t.getStage() == stage && t.isClaimable(staleBefore))
                .sorted(Comparator.comparing(ProcessingTask::getCreatedAt))
                .limit(limit)
                .map(ProcessingTask::getItemId)
                .collect(Collectors.toList());
    }

    @Override
    public List<ProcessingTask> expireExhausted(ProcessingStage stage, String reason, Instant staleBefore, Instant now) {
        List<ProcessingTask> expired = new ArrayList<>();
        for (TaskKey key : new ArrayList<>(tasks.keySet())) {
            if (key.stage != stage) {
                continue;
            }
            tasks.computeIfPresent(key, (k, current) -> {
                if (!current.isStale(staleBefore) || current.getAttemptCount() < current.getMaxAttempts()) {
                    return current;
                }
                ProcessingTask failed = current.toBuilder()
                        .status(TaskStatus.FAILED)
                        .lastError(reason)
                        .completedAt(now)
                        .build();
                expired.add(failed);
                return failed;
            });
        }
        return expired;
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            counts.put(s, 0L);
        }
        tasks.values().forEach(t -> counts.merge(t.getStatus(), 1L, Long::sum));
        return counts;
    }

    @Override
    public double averageCompletionSeconds(Instant since) {
        return tasks.values().stream()
                .filter(t -> t.getStatus() == TaskStatus.COMPLETED)
                .filter(t -> t.getStartedAt() != null && t.getCompletedAt() != null && !t.getCompletedAt().isBefore(since))
                .mapToDouble(t -> Duration.between(t.getStartedAt(), t.getCompletedAt()).toMillis() / 1000.0)
                .average()
                .orElse(0.0);
    }

    @Override
    public int deleteByItems(Collection<String> itemIds) {
        int before = tasks.size();
        tasks.keySet().removeIf(k -> itemIds.contains(k.itemId));
        return before - tasks.size();
    }

    private static ProcessingTask pending(String itemId, ProcessingStage stage, int maxAttempts, Instant now) {
        return ProcessingTask.builder()
                .itemId(itemId)
                .stage(stage)
                .status(TaskStatus.PENDING)
                .attemptCount(0)
                .maxAttempts(maxAttempts)
                .createdAt(now)
                .build();
    }

    private static final class TaskKey {
        private final String itemId;
        private final ProcessingStage stage;

        TaskKey(String itemId, ProcessingStage stage) {
            this.itemId = itemId;
            this.stage = stage;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TaskKey)) return false;
            TaskKey other = (TaskKey) o;
            return itemId.equals(other.itemId) && stage == other.stage;
        }

        @Override
        public int hashCode() {
            return Objects.hash(itemId, stage);
        }
    }
}
