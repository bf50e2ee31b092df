package com.di.insightnova.pipeline.staging;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A raw business event waiting for (or past) validation. Validation, enrichment and embedding
 * results are attached to the same record as the item moves through the pipeline.
 */
@Value
@Builder(toBuilder = true)
public class StagedItem {
    String id;
    String source;
    ItemKind kind;
    JsonNode payload;
    /** 0 (lowest) to 9 (highest). */
    int priority;
    ValidationStatus status;
    Instant ingestedAt;

    Double validationScore;
    Instant validatedAt;
    List<String> issues;
    List<String> suggestedFixes;
    String errorDetails;

    Enrichment enrichment;
    float[] embedding;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    /** Text handed to the enricher, embedder and stream analysis. */
    public String contentText() {
        if (enrichment != null && enrichment.getContent() != null && !enrichment.getContent().isBlank()) {
            return enrichment.getContent();
        }
        if (payload == null) {
            return "";
        }
        JsonNode content = payload.get("content");
        return content != null && content.isTextual() ? content.asText() : payload.toString();
    }
}
