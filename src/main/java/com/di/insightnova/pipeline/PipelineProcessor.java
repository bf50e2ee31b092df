package com.di.insightnova.pipeline;

import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.pipeline.enrichment.DataEnricher;
import com.di.insightnova.pipeline.staging.Enrichment;
import com.di.insightnova.pipeline.staging.StagedItem;
import com.di.insightnova.pipeline.staging.StagingStore;
import com.di.insightnova.pipeline.task.ProcessingStage;
import com.di.insightnova.pipeline.task.ProcessingTask;
import com.di.insightnova.pipeline.task.TaskStatus;
import com.di.insightnova.pipeline.task.TaskTracker;
import com.di.insightnova.pipeline.validation.DataValidator;
import com.di.insightnova.pipeline.validation.ValidationResult;
import com.di.insightnova.stream.StreamEvent;
import com.di.insightnova.stream.StreamEventPublisher;
import com.di.insightnova.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The pipeline job body: validation of pending items, then enrichment, embedding and
 * distribution as a StreamEvent, one ledger task per stage.
 *
 * <p>Each stage is claimed before it runs and re-reads the committed item, so a stage resumed in
 * a later cycle (after a retryable failure or a crashed worker) starts from the stored state.
 * One item's failure never stops the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineProcessor {

    private static final List<ProcessingStage> RESUMABLE_STAGES =
            List.of(ProcessingStage.ENRICHMENT, ProcessingStage.EMBEDDING, ProcessingStage.DISTRIBUTION);

    private final StagingStore stagingStore;
    private final TaskTracker taskTracker;
    private final DataValidator validator;
    private final DataEnricher enricher;
    private final InferenceGateway gateway;
    private final StreamEventPublisher publisher;
    private final PipelineProperties properties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    public PipelineRunSummary processBatch() {
        Counters counters = new Counters();

        for (ProcessingStage stage : List.of(ProcessingStage.VALIDATION, ProcessingStage.ENRICHMENT,
                ProcessingStage.EMBEDDING, ProcessingStage.DISTRIBUTION)) {
            for (ProcessingTask expired : taskTracker.expireStale(stage)) {
                parkForReview(expired.getItemId(), stage, "Stage " + stage + " timed out after "
                        + expired.getAttemptCount() + " attempts");
                counters.failed++;
            }
        }

        List<StagedItem> batch = stagingStore.findPendingBatch(properties.getBatchSize());
        for (StagedItem item : batch) {
            try {
                processNewItem(item, counters);
            } catch (RuntimeException e) {
                log.error("[PIPELINE] Unexpected error on item {}: {}", item.getId(), e.getMessage(), e);
            }
        }

        for (ProcessingStage stage : RESUMABLE_STAGES) {
            for (String itemId : taskTracker.findClaimable(stage, properties.getResumeBatchSize())) {
                if (!counters.touched.add(itemId)) {
                    continue;
                }
                try {
                    counters.resumed++;
                    runFrom(itemId, stage, counters);
                } catch (RuntimeException e) {
                    log.error("[PIPELINE] Unexpected error resuming {}/{}: {}", itemId, stage, e.getMessage(), e);
                }
            }
        }

        PipelineRunSummary summary = counters.toSummary();
        log.info("[PIPELINE] Cycle done: claimed={} valid={} invalid={} published={} retrying={} failed={} resumed={}",
                summary.getClaimed(), summary.getValid(), summary.getInvalid(), summary.getPublished(),
                summary.getRetrying(), summary.getFailed(), summary.getResumed());
        return summary;
    }

    // ------------------------------------------------------------------ //

    private void processNewItem(StagedItem item, Counters counters) {
        if (!taskTracker.claim(item.getId(), ProcessingStage.VALIDATION)) {
            return;
        }
        counters.touched.add(item.getId());
        counters.claimed++;

        ValidationResult result;
        try {
            result = validator.validate(item.getPayload(), item.getSource());
        } catch (RuntimeException e) {
            handleFailure(item.getId(), ProcessingStage.VALIDATION, e, counters);
            return;
        }

        if (result.isAccepted()) {
            stagingStore.markValid(item.getId(), result.getScore(), clock.instant());
            taskTracker.complete(item.getId(), ProcessingStage.VALIDATION);
            metricsCollector.recordItemOutcome(ProcessingStage.VALIDATION.name(), "valid");
            counters.valid++;
            taskTracker.enqueue(item.getId(), ProcessingStage.ENRICHMENT);
            runFrom(item.getId(), ProcessingStage.ENRICHMENT, counters);
        } else {
            String details = result.getIssues().isEmpty()
                    ? "Validation score " + result.getScore() + " did not pass"
                    : String.join("; ", result.getIssues());
            stagingStore.markInvalid(item.getId(), result.getScore(), result.getIssues(), result.getFixes(),
                    details, clock.instant());
            taskTracker.complete(item.getId(), ProcessingStage.VALIDATION);
            metricsCollector.recordItemOutcome(ProcessingStage.VALIDATION.name(), "invalid");
            counters.invalid++;
            log.info("[PIPELINE] Item {} rejected (score={}, schemaValid={})",
                    item.getId(), result.getScore(), result.isSchemaValid());
        }
    }

    /**
     * Runs {@code stage} and every following pipeline stage until one cannot be claimed or fails.
     */
    private void runFrom(String itemId, ProcessingStage stage, Counters counters) {
        ProcessingStage current = stage;
        while (current != null && current != ProcessingStage.ANALYSIS) {
            if (!taskTracker.claim(itemId, current)) {
                return;
            }
            Optional<StagedItem> item = stagingStore.findById(itemId);
            if (item.isEmpty()) {
                log.warn("[PIPELINE] Item {} vanished before {}", itemId, current);
                taskTracker.complete(itemId, current);
                return;
            }
            try {
                execute(item.get(), current, counters);
            } catch (RuntimeException e) {
                handleFailure(itemId, current, e, counters);
                return;
            }
            taskTracker.complete(itemId, current);
            Optional<ProcessingStage> next = current.next();
            next.ifPresent(n -> taskTracker.enqueue(itemId, n));
            current = next.orElse(null);
        }
    }

    private void execute(StagedItem item, ProcessingStage stage, Counters counters) {
        switch (stage) {
            case ENRICHMENT: {
                Enrichment enrichment = enricher.enrich(item.getPayload(), properties.getEnrichmentSources());
                stagingStore.saveEnrichment(item.getId(), enrichment);
                break;
            }
            case EMBEDDING: {
                float[] embedding = gateway.generateEmbedding(item.contentText());
                stagingStore.saveEmbedding(item.getId(), embedding);
                break;
            }
            case DISTRIBUTION: {
                StreamEvent event = publisher.publish(item);
                metricsCollector.recordItemOutcome(stage.name(), "published");
                counters.published++;
                log.info("[PIPELINE] Item {} published as stream event {}", item.getId(), event.getId());
                break;
            }
            default:
                throw new IllegalStateException("Stage " + stage + " is not run by the pipeline job");
        }
    }

    private void handleFailure(String itemId, ProcessingStage stage, RuntimeException e, Counters counters) {
        String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
        TaskStatus status = taskTracker.fail(itemId, stage, reason);
        if (status == TaskStatus.FAILED) {
            parkForReview(itemId, stage, reason);
            counters.failed++;
        } else {
            metricsCollector.recordItemOutcome(stage.name(), "retrying");
            counters.retrying++;
            log.warn("[PIPELINE] Item {} failed at {} and will be retried: {}", itemId, stage, reason);
        }
    }

    private void parkForReview(String itemId, ProcessingStage stage, String reason) {
        stagingStore.markNeedsReview(itemId, stage + ": " + reason, clock.instant());
        metricsCollector.recordItemOutcome(stage.name(), "needs_review");
        log.error("[PIPELINE] Item {} failed permanently at {} after {} attempts: {}",
                itemId, stage, taskTracker.getMaxAttempts(), reason);
    }

    private static final class Counters {
        int claimed;
        int valid;
        int invalid;
        int published;
        int retrying;
        int failed;
        int resumed;
        // One attempt per item per cycle.
        final Set<String> touched = new HashSet<>();

        PipelineRunSummary toSummary() {
            return PipelineRunSummary.builder()
                    .claimed(claimed).valid(valid).invalid(invalid).published(published)
                    .retrying(retrying).failed(failed).resumed(resumed)
                    .build();
        }
    }
}
