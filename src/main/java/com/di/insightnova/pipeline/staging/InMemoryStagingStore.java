package com.di.insightnova.pipeline.staging;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory staging store. Suitable for single-node and testing.
 * When insightnova.persistence.jdbc-enabled=true, JdbcStagingStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "insightnova.persistence.jdbc-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryStagingStore implements StagingStore {

    private static final Comparator<StagedItem> BATCH_ORDER =
            Comparator.comparingInt(StagedItem::getPriority).reversed()
                    .thenComparing(StagedItem::getIngestedAt);

    private final Map<String, StagedItem> items = new ConcurrentHashMap<>();

    @Override
    public void save(StagedItem item) {
        if (item == null || item.getId() == null) return;
        items.put(item.getId(), item);
    }

    @Override
    public Optional<StagedItem> findById(String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<StagedItem> findPendingBatch(int limit) {
        return items.values().stream()
                .filter(i -> i.getStatus() == ValidationStatus.PENDING)
                .sorted(BATCH_ORDER)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public boolean markValid(String id, double score, Instant now) {
        return transition(id, EnumSet.of(ValidationStatus.PENDING), current -> current.toBuilder()
                .status(ValidationStatus.VALID)
                .validationScore(score)
                .validatedAt(now)
                .build());
    }

    @Override
    public boolean markInvalid(String id, double score, List<String> issues, List<String> fixes,
                               String errorDetails, Instant now) {
        return transition(id, EnumSet.of(ValidationStatus.PENDING), current -> current.toBuilder()
                .status(ValidationStatus.INVALID)
                .validationScore(score)
                .validatedAt(now)
                .issues(List.copyOf(issues))
                .suggestedFixes(List.copyOf(fixes))
                .errorDetails(errorDetails)
                .build());
    }

    @Override
    public boolean markNeedsReview(String id, String reason, Instant now) {
        return transition(id, EnumSet.of(ValidationStatus.PENDING, ValidationStatus.VALID), current -> current.toBuilder()
                .status(ValidationStatus.NEEDS_REVIEW)
                .errorDetails(reason)
                .validatedAt(current.getValidatedAt() != null ? current.getValidatedAt() : now)
                .build());
    }

    @Override
    public void saveEnrichment(String id, Enrichment enrichment) {
        items.computeIfPresent(id, (k, current) -> current.toBuilder().enrichment(enrichment).build());
    }

    @Override
    public void saveEmbedding(String id, float[] embedding) {
        items.computeIfPresent(id, (k, current) -> current.toBuilder().embedding(embedding).build());
    }

    @Override
    public long countByStatus(ValidationStatus status) {
        return items.values().stream().filter(i -> i.getStatus() == status).count();
    }

    @Override
    public long countByStatusSince(ValidationStatus status, Instant since) {
        return items.values().stream()
                .filter(i -> i.getStatus() == status && !i.getIngestedAt().isBefore(since))
                .count();
    }

    @Override
    public List<String> deleteTerminalBefore(Instant cutoff) {
        List<String> deleted = new ArrayList<>();
        for (StagedItem item : new ArrayList<>(items.values())) {
            if (item.getStatus().isTerminal() && item.getIngestedAt().isBefore(cutoff)
                    && items.remove(item.getId(), item)) {
                deleted.add(item.getId());
            }
        }
        return deleted;
    }

    private boolean transition(String id, Set<ValidationStatus> from,
                               java.util.function.UnaryOperator<StagedItem> change) {
        boolean[] changed = {false};
        items.computeIfPresent(id, (k, current) -> {
            if (!from.contains(current.getStatus())) {
                return current;
            }
            changed[0] = true;
            return change.apply(current);
        });
        return changed[0];
    }
}
