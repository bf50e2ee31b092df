package com.di.insightnova.pipeline.staging;

import com.di.insightnova.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of StagingStore (table staged_items). JSON-shaped fields (payload, issues,
 * enrichment lists, embedding, metadata) are stored as JSON text. Status changes are conditional
 * UPDATEs on the current status. Enable with insightnova.persistence.jdbc-enabled=true.
 */
@Component
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "true")
public class JdbcStagingStore implements StagingStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;
    private final RowMapper<StagedItem> rowMapper;

    public JdbcStagingStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
        this.rowMapper = this::mapRow;
    }

    private StagedItem mapRow(ResultSet rs, int rowNum) throws SQLException {
        double score = rs.getDouble("validation_score");
        Double validationScore = rs.wasNull() ? null : score;
        Enrichment enrichment = null;
        if (rs.getString("enriched_content") != null) {
            enrichment = Enrichment.builder()
                    .content(rs.getString("enriched_content"))
                    .entities(readList(rs.getString("entities")))
                    .categories(readList(rs.getString("categories")))
                    .sourcesUsed(readList(rs.getString("sources_used")))
                    .enrichedAt(toInstant(rs.getTimestamp("enriched_at")))
                    .build();
        }
        String metadata = rs.getString("metadata");
        return StagedItem.builder()
                .id(rs.getString("id"))
                .source(rs.getString("source"))
                .kind(ItemKind.valueOf(rs.getString("kind")))
                .payload(readTree(rs.getString("payload")))
                .priority(rs.getInt("priority"))
                .status(ValidationStatus.valueOf(rs.getString("status")))
                .ingestedAt(toInstant(rs.getTimestamp("ingested_at")))
                .validationScore(validationScore)
                .validatedAt(toInstant(rs.getTimestamp("validated_at")))
                .issues(readList(rs.getString("issues")))
                .suggestedFixes(readList(rs.getString("suggested_fixes")))
                .errorDetails(rs.getString("error_details"))
                .enrichment(enrichment)
                .embedding(readEmbedding(rs.getString("embedding")))
                .metadata(metadata != null ? read(metadata, STRING_MAP) : Map.of())
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public void save(StagedItem item) {
        if (item == null || item.getId() == null) return;
        jdbc.update(sql.getStaging().getInsert(),
                item.getId(),
                item.getSource(),
                item.getKind().name(),
                write(item.getPayload()),
                item.getPriority(),
                item.getStatus().name(),
                toTimestamp(item.getIngestedAt()),
                write(item.getMetadata()));
    }

    @Override
    public Optional<StagedItem> findById(String id) {
        List<StagedItem> list = jdbc.query(sql.getStaging().getFindById(), rowMapper, id);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<StagedItem> findPendingBatch(int limit) {
        return jdbc.query(sql.getStaging().getFindPendingBatch(), rowMapper, Math.max(1, limit));
    }

    @Override
    public boolean markValid(String id, double score, Instant now) {
        return jdbc.update(sql.getStaging().getMarkValid(), score, toTimestamp(now), id) == 1;
    }

    @Override
    public boolean markInvalid(String id, double score, List<String> issues, List<String> fixes,
                               String errorDetails, Instant now) {
        return jdbc.update(sql.getStaging().getMarkInvalid(),
                score, toTimestamp(now), write(issues), write(fixes), errorDetails, id) == 1;
    }

    @Override
    public boolean markNeedsReview(String id, String reason, Instant now) {
        return jdbc.update(sql.getStaging().getMarkNeedsReview(), reason, toTimestamp(now), id) == 1;
    }

    @Override
    public void saveEnrichment(String id, Enrichment enrichment) {
        jdbc.update(sql.getStaging().getSaveEnrichment(),
                enrichment.getContent(),
                write(enrichment.getEntities()),
                write(enrichment.getCategories()),
                write(enrichment.getSourcesUsed()),
                toTimestamp(enrichment.getEnrichedAt()),
                id);
    }

    @Override
    public void saveEmbedding(String id, float[] embedding) {
        jdbc.update(sql.getStaging().getSaveEmbedding(), write(embedding), id);
    }

    @Override
    public long countByStatus(ValidationStatus status) {
        Long count = jdbc.queryForObject(sql.getStaging().getCountByStatus(), Long.class, status.name());
        return count != null ? count : 0L;
    }

    @Override
    public long countByStatusSince(ValidationStatus status, Instant since) {
        Long count = jdbc.queryForObject(sql.getStaging().getCountByStatusSince(), Long.class,
                status.name(), toTimestamp(since));
        return count != null ? count : 0L;
    }

    @Override
    public List<String> deleteTerminalBefore(Instant cutoff) {
        return jdbc.queryForList(sql.getStaging().getDeleteTerminalBefore(), String.class, toTimestamp(cutoff));
    }

    // ------------------------------------------------------------------ //

    private String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise staged item field: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTree(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt staged item payload: " + e.getOriginalMessage(), e);
        }
    }

    private List<String> readList(String json) {
        return json == null ? List.of() : read(json, STRING_LIST);
    }

    private float[] readEmbedding(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt embedding: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt staged item field: " + e.getOriginalMessage(), e);
        }
    }
}
