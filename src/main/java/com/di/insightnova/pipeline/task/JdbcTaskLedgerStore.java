package com.di.insightnova.pipeline.task;

import com.di.insightnova.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TaskLedgerStore (table processing_tasks). A claim is one conditional
 * UPDATE whose row count decides the winner; FAIL and expiry use {@code RETURNING} so the
 * resulting state comes from the same statement. Enable with insightnova.persistence.jdbc-enabled=true.
 */
@Component
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "true")
public class JdbcTaskLedgerStore implements TaskLedgerStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcTaskLedgerStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<ProcessingTask> TASK_ROW_MAPPER = (rs, rowNum) -> ProcessingTask.builder()
            .itemId(rs.getString("item_id"))
            .stage(ProcessingStage.valueOf(rs.getString("stage")))
            .status(TaskStatus.valueOf(rs.getString("status")))
            .attemptCount(rs.getInt("attempt_count"))
            .maxAttempts(rs.getInt("max_attempts"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .startedAt(toInstant(rs.getTimestamp("started_at")))
            .completedAt(toInstant(rs.getTimestamp("completed_at")))
            .lastError(rs.getString("last_error"))
            .assignedWorker(rs.getString("assigned_worker"))
            .build();

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public void insertIfAbsent(String itemId, ProcessingStage stage, int maxAttempts, Instant now) {
        jdbc.update(sql.getTasks().getInsertIfAbsent(), itemId, stage.name(), maxAttempts, toTimestamp(now));
    }

    @Override
    public boolean claim(String itemId, ProcessingStage stage, String workerId, Instant now, Instant staleBefore) {
        int updated = jdbc.update(sql.getTasks().getClaim(),
                toTimestamp(now), workerId, itemId, stage.name(), toTimestamp(staleBefore));
        return updated == 1;
    }

    @Override
    public boolean complete(String itemId, ProcessingStage stage, Instant now) {
        return jdbc.update(sql.getTasks().getComplete(), toTimestamp(now), itemId, stage.name()) == 1;
    }

    @Override
    public Optional<TaskStatus> fail(String itemId, ProcessingStage stage, String reason, Instant now) {
        List<String> statuses = jdbc.queryForList(sql.getTasks().getFail(), String.class,
                reason, toTimestamp(now), itemId, stage.name());
        return statuses.isEmpty() ? Optional.empty() : Optional.of(TaskStatus.valueOf(statuses.get(0)));
    }

    @Override
    public boolean abandon(String itemId, ProcessingStage stage, String reason, Instant now) {
        return jdbc.update(sql.getTasks().getAbandon(), reason, toTimestamp(now), itemId, stage.name()) == 1;
    }

    @Override
    public Optional<ProcessingTask> find(String itemId, ProcessingStage stage) {
        List<ProcessingTask> list = jdbc.query(sql.getTasks().getFind(), TASK_ROW_MAPPER, itemId, stage.name());
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<ProcessingTask> findByItem(String itemId) {
        return jdbc.query(sql.getTasks().getFindByItem(), TASK_ROW_MAPPER, itemId);
    }

    @Override
    public List<String> findClaimable(ProcessingStage stage, Instant staleBefore, int limit) {
        return jdbc.queryForList(sql.getTasks().getFindClaimable(), String.class,
                stage.name(), toTimestamp(staleBefore), Math.max(1, limit));
    }

    @Override
    public List<ProcessingTask> expireExhausted(ProcessingStage stage, String reason, Instant staleBefore, Instant now) {
        return jdbc.query(sql.getTasks().getExpire(), TASK_ROW_MAPPER,
                reason, toTimestamp(now), stage.name(), toTimestamp(staleBefore));
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            counts.put(s, 0L);
        }
        jdbc.query(sql.getTasks().getCountByStatus(), rs -> {
            counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
        return counts;
    }

    @Override
    public double averageCompletionSeconds(Instant since) {
        Double avg = jdbc.queryForObject(sql.getTasks().getAverageCompletionSecondsSince(), Double.class, toTimestamp(since));
        return avg != null ? avg : 0.0;
    }

    @Override
    public int deleteByItems(Collection<String> itemIds) {
        if (itemIds.isEmpty()) return 0;
        int[] counts = jdbc.batchUpdate(sql.getTasks().getDeleteByItem(),
                itemIds.stream().map(id -> new Object[]{id}).collect(Collectors.toList()));
        int total = 0;
        for (int c : counts) total += Math.max(c, 0);
        return total;
    }
}
