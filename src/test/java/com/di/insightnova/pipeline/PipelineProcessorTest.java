package com.di.insightnova.pipeline;

import com.di.insightnova.pipeline.staging.StagedItem;
import com.di.insightnova.pipeline.staging.ValidationStatus;
import com.di.insightnova.pipeline.task.ProcessingStage;
import com.di.insightnova.pipeline.task.TaskStatus;
import com.di.insightnova.stream.StreamEvent;
import com.di.insightnova.stream.StreamEventStatus;
import com.di.insightnova.support.InsightNovaFixture;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineProcessor Tests")
class PipelineProcessorTest {

    private static final String VALIDATE = "Validate this data against expected schema";
    private static final String QUALITY = "Rate data quality";
    private static final String ENRICH = "Enrich this data with additional context";

    private final ObjectMapper mapper = new ObjectMapper();
    private InsightNovaFixture f;

    @BeforeEach
    void setUp() {
        f = new InsightNovaFixture();
        f.stub.onBool(true, VALIDATE)
                .onDouble(0.9, QUALITY)
                .onText("missing region\n- stale timestamp", "Identify specific data quality issues")
                .onText("1. add region", "Suggest specific fixes")
                .onText("Enriched: revenue spike in EMEA", ENRICH)
                .onText("- ACME Corp\n- EMEA", "Extract key entities")
                .onText("sales\nfinance", "Categorize and tag");
    }

    private String ingest(String content) throws Exception {
        return f.ingestionService.ingest("crm",
                mapper.readTree("{\"content\":\"" + content + "\",\"timestamp\":\"2026-03-02T08:59:00Z\",\"source\":\"crm\"}"),
                5);
    }

    // ============================================================================
    // Happy path
    // ============================================================================

    @Test
    @DisplayName("Should validate, enrich, embed and publish a good item in one cycle")
    void testValidItemIsPublished() throws Exception {
        String id = ingest("Revenue up 12% in EMEA");

        PipelineRunSummary summary = f.pipelineProcessor.processBatch();

        assertEquals(1, summary.getClaimed());
        assertEquals(1, summary.getValid());
        assertEquals(1, summary.getPublished());
        assertEquals(0, summary.getRetrying());

        StagedItem item = f.stagingStore.findById(id).orElseThrow();
        assertEquals(ValidationStatus.VALID, item.getStatus());
        assertEquals(0.9, item.getValidationScore(), 1e-9);
        assertEquals("Enriched: revenue spike in EMEA", item.getEnrichment().getContent());
        assertEquals(List.of("ACME Corp", "EMEA"), item.getEnrichment().getEntities());
        assertEquals(List.of("sales", "finance"), item.getEnrichment().getCategories());
        assertNotNull(item.getEmbedding());

        StreamEvent event = f.streamEventStore.findByStagedItemId(id).orElseThrow();
        assertEquals(StreamEventStatus.PENDING, event.getStatus());
        assertEquals("Enriched: revenue spike in EMEA", event.getContent());

        for (ProcessingStage stage : List.of(ProcessingStage.VALIDATION, ProcessingStage.ENRICHMENT,
                ProcessingStage.EMBEDDING, ProcessingStage.DISTRIBUTION)) {
            assertEquals(TaskStatus.COMPLETED, f.taskTracker.find(id, stage).orElseThrow().getStatus(), stage.name());
        }
        assertEquals(TaskStatus.PENDING, f.taskTracker.find(id, ProcessingStage.ANALYSIS).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should not publish the same item twice across cycles")
    void testNoDuplicatePublication() throws Exception {
        ingest("Revenue up");
        f.pipelineProcessor.processBatch();
        PipelineRunSummary second = f.pipelineProcessor.processBatch();

        assertEquals(0, second.getClaimed());
        assertEquals(0, second.getPublished());
        assertEquals(1, f.streamEventStore.countByStatus(StreamEventStatus.PENDING));
    }

    // ============================================================================
    // Rejection
    // ============================================================================

    @Test
    @DisplayName("Should reject an item whose quality score does not exceed the threshold")
    void testScoreAtThresholdIsInvalid() throws Exception {
        f.stub.onDouble(0.7, QUALITY);
        String id = ingest("Revenue up");

        PipelineRunSummary summary = f.pipelineProcessor.processBatch();

        assertEquals(1, summary.getInvalid());
        StagedItem item = f.stagingStore.findById(id).orElseThrow();
        assertEquals(ValidationStatus.INVALID, item.getStatus());
        assertEquals(List.of("missing region", "stale timestamp"), item.getIssues());
        assertEquals(List.of("add region"), item.getSuggestedFixes());
        assertTrue(f.streamEventStore.findByStagedItemId(id).isEmpty());
        assertEquals(0, f.stub.count(ENRICH));
    }

    @Test
    @DisplayName("Should reject an item the schema check fails even with a high score")
    void testSchemaVerdictIsRequired() throws Exception {
        f.stub.onBool(false, VALIDATE);
        String id = ingest("Revenue up");

        f.pipelineProcessor.processBatch();

        assertEquals(ValidationStatus.INVALID, f.stagingStore.findById(id).orElseThrow().getStatus());
    }

    // ============================================================================
    // Failures and retries
    // ============================================================================

    @Test
    @DisplayName("Should retry a failing validation and park the item for review after the last attempt")
    void testValidationFailureExhaustsAttempts() throws Exception {
        f.stub.failOn(VALIDATE);
        String id = ingest("Revenue up");

        PipelineRunSummary first = f.pipelineProcessor.processBatch();
        assertEquals(1, first.getRetrying());
        assertEquals(ValidationStatus.PENDING, f.stagingStore.findById(id).orElseThrow().getStatus());
        assertEquals(TaskStatus.RETRYING, f.taskTracker.find(id, ProcessingStage.VALIDATION).orElseThrow().getStatus());

        f.pipelineProcessor.processBatch();
        PipelineRunSummary third = f.pipelineProcessor.processBatch();

        assertEquals(1, third.getFailed());
        StagedItem item = f.stagingStore.findById(id).orElseThrow();
        assertEquals(ValidationStatus.NEEDS_REVIEW, item.getStatus());
        assertTrue(item.getErrorDetails().startsWith("VALIDATION"));
        assertEquals(3, f.stub.count(VALIDATE));

        PipelineRunSummary fourth = f.pipelineProcessor.processBatch();
        assertEquals(0, fourth.getClaimed());
        assertEquals(3, f.stub.count(VALIDATE));
    }

    @Test
    @DisplayName("Should resume a failed enrichment in the next cycle without re-validating")
    void testEnrichmentResumes() throws Exception {
        f.stub.failOn(ENRICH);
        String id = ingest("Revenue up");

        PipelineRunSummary first = f.pipelineProcessor.processBatch();
        assertEquals(1, first.getValid());
        assertEquals(1, first.getRetrying());
        assertEquals(1, f.stub.count(ENRICH));
        assertEquals(TaskStatus.RETRYING, f.taskTracker.find(id, ProcessingStage.ENRICHMENT).orElseThrow().getStatus());

        f.stub.clearFailures();
        PipelineRunSummary second = f.pipelineProcessor.processBatch();

        assertEquals(1, second.getResumed());
        assertEquals(1, second.getPublished());
        assertEquals(1, f.stub.count(VALIDATE));
        assertEquals(2, f.taskTracker.find(id, ProcessingStage.ENRICHMENT).orElseThrow().getAttemptCount());
        assertTrue(f.streamEventStore.findByStagedItemId(id).isPresent());
    }

    @Test
    @DisplayName("Should keep processing the batch when one item fails")
    void testOneFailureDoesNotStopTheBatch() throws Exception {
        f.stub.failOn(VALIDATE, "poison");
        String bad = ingest("poison record");
        String good = ingest("Revenue up");

        PipelineRunSummary summary = f.pipelineProcessor.processBatch();

        assertEquals(2, summary.getClaimed());
        assertEquals(1, summary.getPublished());
        assertEquals(ValidationStatus.PENDING, f.stagingStore.findById(bad).orElseThrow().getStatus());
        assertEquals(ValidationStatus.VALID, f.stagingStore.findById(good).orElseThrow().getStatus());
    }
}
