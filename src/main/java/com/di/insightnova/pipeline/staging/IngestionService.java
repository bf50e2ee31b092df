package com.di.insightnova.pipeline.staging;

import com.di.insightnova.aspect.LogJob;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Entry point of the pipeline: writes raw events into the staging store as PENDING.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    public static final int DEFAULT_PRIORITY = 5;
    static final int MIN_PRIORITY = 0;
    static final int MAX_PRIORITY = 9;

    private final StagingStore stagingStore;
    private final Clock clock;

    /**
     * Stages one event.
     *
     * @param source   producing system; must not be blank
     * @param payload  raw event; must not be null
     * @param priority 0–9, clamped; null means {@value #DEFAULT_PRIORITY}
     * @return the new item id
     */
    @LogJob(eventType = "INGEST", operation = "staging_ingest", parameterNames = {"source"})
    public String ingest(String source, JsonNode payload, Integer priority) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new IllegalArgumentException("payload must not be null");
        }
        int effectivePriority = clampPriority(priority == null ? DEFAULT_PRIORITY : priority);
        ItemKind kind = ItemKind.infer(payload);

        StagedItem item = StagedItem.builder()
                .id(UUID.randomUUID().toString())
                .source(source.trim())
                .kind(kind)
                .payload(payload)
                .priority(effectivePriority)
                .status(ValidationStatus.PENDING)
                .ingestedAt(clock.instant())
                .metadataEntry("ingestion_method", "api")
                .build();
        stagingStore.save(item);
        log.info("[INGEST] Staged item {} from {} (kind={}, priority={})", item.getId(), item.getSource(), kind, effectivePriority);
        return item.getId();
    }

    static int clampPriority(int priority) {
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }
}
