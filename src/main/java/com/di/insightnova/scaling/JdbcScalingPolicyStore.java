package com.di.insightnova.scaling;

import com.di.insightnova.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ScalingPolicyStore (table scaling_policies). The compare-and-set is a
 * single {@code UPDATE … WHERE version = ?}. Enable with insightnova.persistence.jdbc-enabled=true.
 */
@Component
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "true")
public class JdbcScalingPolicyStore implements ScalingPolicyStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcScalingPolicyStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<ScalingPolicy> POLICY_ROW_MAPPER = (rs, rowNum) -> {
        Timestamp lastAction = rs.getTimestamp("last_action_at");
        String state = rs.getString("last_state");
        return ScalingPolicy.builder()
                .resourceType(ResourceType.valueOf(rs.getString("resource_type")))
                .minCapacity(rs.getInt("min_capacity"))
                .maxCapacity(rs.getInt("max_capacity"))
                .currentCapacity(rs.getInt("current_capacity"))
                .scaleUpThreshold(rs.getDouble("scale_up_threshold"))
                .scaleDownThreshold(rs.getDouble("scale_down_threshold"))
                .scaleUpIncrement(rs.getInt("scale_up_increment"))
                .scaleDownIncrement(rs.getInt("scale_down_increment"))
                .cooldown(Duration.ofSeconds(rs.getLong("cooldown_seconds")))
                .unitCost(rs.getDouble("unit_cost"))
                .lastActionAt(lastAction != null ? lastAction.toInstant() : null)
                .active(rs.getBoolean("active"))
                .lastState(state != null ? ScalingState.valueOf(state) : ScalingState.EVALUATING)
                .version(rs.getLong("version"))
                .build();
    };

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public List<ScalingPolicy> findAll() {
        return jdbc.query(sql.getScaling().getFindAll(), POLICY_ROW_MAPPER);
    }

    @Override
    public Optional<ScalingPolicy> findByType(ResourceType type) {
        return jdbc.query(sql.getScaling().getFindByType(), POLICY_ROW_MAPPER, type.name()).stream().findFirst();
    }

    @Override
    public boolean insertIfAbsent(ScalingPolicy p) {
        int inserted = jdbc.update(sql.getScaling().getInsert(),
                p.getResourceType().name(), p.getMinCapacity(), p.getMaxCapacity(), p.getCurrentCapacity(),
                p.getScaleUpThreshold(), p.getScaleDownThreshold(), p.getScaleUpIncrement(),
                p.getScaleDownIncrement(), p.getCooldown().toSeconds(), p.getUnitCost(),
                toTimestamp(p.getLastActionAt()), p.isActive(), stateName(p));
        return inserted == 1;
    }

    @Override
    public boolean compareAndSet(ScalingPolicy p, long expectedVersion) {
        int updated = jdbc.update(sql.getScaling().getCompareAndSet(),
                p.getMinCapacity(), p.getMaxCapacity(), p.getCurrentCapacity(),
                p.getScaleUpThreshold(), p.getScaleDownThreshold(), p.getScaleUpIncrement(),
                p.getScaleDownIncrement(), p.getCooldown().toSeconds(), p.getUnitCost(),
                toTimestamp(p.getLastActionAt()), p.isActive(), stateName(p),
                p.getResourceType().name(), expectedVersion);
        return updated == 1;
    }

    private static String stateName(ScalingPolicy p) {
        return p.getLastState() != null ? p.getLastState().name() : ScalingState.EVALUATING.name();
    }
}
