package com.di.insightnova.pipeline.staging;

import com.fasterxml.jackson.databind.JsonNode;

public enum ItemKind {
    STRUCTURED,
    UNSTRUCTURED,
    MULTIMODAL,
    STREAM;

    /**
     * Infers the kind from the payload shape: {@code type=image} is multimodal, {@code type=stream}
     * is a stream record, {@code structured=true} is structured, anything else unstructured.
     */
    public static ItemKind infer(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return UNSTRUCTURED;
        }
        String type = payload.path("type").asText("");
        if ("image".equalsIgnoreCase(type)) {
            return MULTIMODAL;
        }
        if ("stream".equalsIgnoreCase(type)) {
            return STREAM;
        }
        if (payload.path("structured").asBoolean(false)) {
            return STRUCTURED;
        }
        return UNSTRUCTURED;
    }
}
