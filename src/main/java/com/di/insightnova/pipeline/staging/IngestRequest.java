package com.di.insightnova.pipeline.staging;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Body of {@code POST /api/ingest}. Blank source and missing payload are rejected by
 * {@link IngestionService}.
 */
@Data
public class IngestRequest {
    private String source;
    private JsonNode payload;
    /** 0–9, clamped; defaults to 5. */
    private Integer priority;
}
