package com.di.insightnova.pipeline.task;

import java.util.Optional;

/**
 * Stages a staged item passes through. Pipeline stages run in declaration order up to
 * DISTRIBUTION; ANALYSIS belongs to the stream job and follows distribution.
 */
public enum ProcessingStage {
    VALIDATION,
    ENRICHMENT,
    EMBEDDING,
    DISTRIBUTION,
    ANALYSIS;

    /** Stage enqueued once this one completes; empty after ANALYSIS. */
    public Optional<ProcessingStage> next() {
        switch (this) {
            case VALIDATION:
                return Optional.of(ENRICHMENT);
            case ENRICHMENT:
                return Optional.of(EMBEDDING);
            case EMBEDDING:
                return Optional.of(DISTRIBUTION);
            case DISTRIBUTION:
                return Optional.of(ANALYSIS);
            default:
                return Optional.empty();
        }
    }
}
