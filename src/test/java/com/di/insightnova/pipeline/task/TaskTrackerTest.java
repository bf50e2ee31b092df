package com.di.insightnova.pipeline.task;

import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaskTracker Tests")
class TaskTrackerTest {

    private MutableClock clock;
    private PipelineProperties properties;
    private TaskTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T09:00:00Z");
        properties = new PipelineProperties();
        tracker = new TaskTracker(new InMemoryTaskLedgerStore(), properties, clock);
    }

    // ============================================================================
    // Claiming
    // ============================================================================

    @Test
    @DisplayName("Should create the task on first claim and refuse a second claim while processing")
    void testClaimIsExclusive() {
        assertTrue(tracker.claim("item-1", ProcessingStage.VALIDATION));
        assertFalse(tracker.claim("item-1", ProcessingStage.VALIDATION));

        ProcessingTask task = tracker.find("item-1", ProcessingStage.VALIDATION).orElseThrow();
        assertEquals(TaskStatus.PROCESSING, task.getStatus());
        assertEquals(1, task.getAttemptCount());
        assertNotNull(task.getAssignedWorker());
    }

    @Test
    @DisplayName("Should refuse claims on a completed task")
    void testCompletedTaskIsNotClaimable() {
        assertTrue(tracker.claim("item-1", ProcessingStage.ENRICHMENT));
        tracker.complete("item-1", ProcessingStage.ENRICHMENT);
        tracker.complete("item-1", ProcessingStage.ENRICHMENT);

        assertFalse(tracker.claim("item-1", ProcessingStage.ENRICHMENT));
        assertEquals(TaskStatus.COMPLETED,
                tracker.find("item-1", ProcessingStage.ENRICHMENT).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should let exactly one of many concurrent workers win a claim")
    void testConcurrentClaimsHaveOneWinner() throws Exception {
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return tracker.claim("contended", ProcessingStage.VALIDATION);
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    // ============================================================================
    // Retry bound
    // ============================================================================

    @Test
    @DisplayName("Should allow exactly maxAttempts attempts before failing permanently")
    void testRetryBound() {
        assertEquals(3, properties.getTasks().getMaxAttempts());

        assertTrue(tracker.claim("item-1", ProcessingStage.VALIDATION));
        assertEquals(TaskStatus.RETRYING, tracker.fail("item-1", ProcessingStage.VALIDATION, "boom"));
        assertTrue(tracker.claim("item-1", ProcessingStage.VALIDATION));
        assertEquals(TaskStatus.RETRYING, tracker.fail("item-1", ProcessingStage.VALIDATION, "boom"));
        assertTrue(tracker.claim("item-1", ProcessingStage.VALIDATION));
        assertEquals(TaskStatus.FAILED, tracker.fail("item-1", ProcessingStage.VALIDATION, "boom"));

        assertFalse(tracker.claim("item-1", ProcessingStage.VALIDATION));
        ProcessingTask task = tracker.find("item-1", ProcessingStage.VALIDATION).orElseThrow();
        assertEquals(3, task.getAttemptCount());
        assertEquals("boom", task.getLastError());
        assertNotNull(task.getCompletedAt());
    }

    @Test
    @DisplayName("Should ignore a failure report for a task that is not processing")
    void testFailWithoutClaim() {
        tracker.enqueue("item-1", ProcessingStage.EMBEDDING);
        assertEquals(TaskStatus.PENDING, tracker.fail("item-1", ProcessingStage.EMBEDDING, "late"));
        assertEquals(0, tracker.find("item-1", ProcessingStage.EMBEDDING).orElseThrow().getAttemptCount());
    }

    // ============================================================================
    // Stale work
    // ============================================================================

    @Test
    @DisplayName("Should make a task stuck past the timeout claimable again")
    void testStaleTaskIsReclaimed() {
        assertTrue(tracker.claim("item-1", ProcessingStage.VALIDATION));
        clock.advance(Duration.ofMinutes(5));
        assertFalse(tracker.claim("item-1", ProcessingStage.VALIDATION));

        clock.advance(Duration.ofMinutes(6));
        assertEquals(List.of("item-1"), tracker.findClaimable(ProcessingStage.VALIDATION, 10));
        assertTrue(tracker.claim("item-1", ProcessingStage.VALIDATION));
        assertEquals(2, tracker.find("item-1", ProcessingStage.VALIDATION).orElseThrow().getAttemptCount());
    }

    @Test
    @DisplayName("Should expire stuck tasks that have no attempts left")
    void testExpireStaleExhausted() {
        properties.getTasks().setMaxAttempts(1);
        assertTrue(tracker.claim("item-1", ProcessingStage.DISTRIBUTION));
        assertTrue(tracker.claim("item-2", ProcessingStage.DISTRIBUTION));
        tracker.complete("item-2", ProcessingStage.DISTRIBUTION);

        assertTrue(tracker.expireStale(ProcessingStage.DISTRIBUTION).isEmpty());

        clock.advance(Duration.ofMinutes(11));
        List<ProcessingTask> expired = tracker.expireStale(ProcessingStage.DISTRIBUTION);
        assertEquals(1, expired.size());
        assertEquals("item-1", expired.get(0).getItemId());
        assertEquals(TaskStatus.FAILED, expired.get(0).getStatus());
        assertEquals(TaskTracker.TIMEOUT_REASON, expired.get(0).getLastError());
        assertFalse(tracker.claim("item-1", ProcessingStage.DISTRIBUTION));
    }

    @Test
    @DisplayName("Should count tasks by status and forget them by item")
    void testCountsAndForget() {
        tracker.claim("item-1", ProcessingStage.VALIDATION);
        tracker.enqueue("item-2", ProcessingStage.VALIDATION);
        tracker.enqueue("item-2", ProcessingStage.VALIDATION);

        assertEquals(1L, tracker.counts().get(TaskStatus.PROCESSING));
        assertEquals(1L, tracker.counts().get(TaskStatus.PENDING));
        assertEquals(0L, tracker.counts().get(TaskStatus.FAILED));

        assertEquals(2, tracker.forget(List.of("item-1", "item-2")));
        assertTrue(tracker.findByItem("item-1").isEmpty());
    }
}
