package com.di.insightnova.pipeline.staging;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable staging area. Status transitions are conditional on the current status, so an item
 * that left PENDING can never be pulled back into it.
 */
public interface StagingStore {

    void save(StagedItem item);

    Optional<StagedItem> findById(String id);

    /** PENDING items, highest priority first, then oldest first. */
    List<StagedItem> findPendingBatch(int limit);

    boolean markValid(String id, double score, Instant now);

    boolean markInvalid(String id, double score, List<String> issues, List<String> fixes, String errorDetails, Instant now);

    /** PENDING or VALID → NEEDS_REVIEW with the failure reason as error details. */
    boolean markNeedsReview(String id, String reason, Instant now);

    void saveEnrichment(String id, Enrichment enrichment);

    void saveEmbedding(String id, float[] embedding);

    long countByStatus(ValidationStatus status);

    long countByStatusSince(ValidationStatus status, Instant since);

    /**
     * Deletes VALID, INVALID and NEEDS_REVIEW items ingested before {@code cutoff}.
     *
     * @return ids of the deleted items
     */
    List<String> deleteTerminalBefore(Instant cutoff);
}
