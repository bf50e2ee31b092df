package com.di.insightnova.scheduler;

import com.di.insightnova.performance.InMemoryPerformanceSampleStore;
import com.di.insightnova.performance.PerformanceSample;
import com.di.insightnova.support.MutableClock;
import com.di.insightnova.util.JobEventLogger;
import com.di.insightnova.util.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobRunner Tests")
class JobRunnerTest {

    private SimpleMeterRegistry registry;
    private InMemoryPerformanceSampleStore samples;
    private MutableClock clock;
    private JobRunner runner;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        samples = new InMemoryPerformanceSampleStore();
        clock = MutableClock.at("2026-03-02T09:00:00Z");
        SchedulerProperties properties = new SchedulerProperties();
        properties.getTimeouts().put("pipeline", Duration.ofSeconds(150));
        runner = new JobRunner(properties, new MetricsCollector(registry), samples,
                new JobEventLogger("insightnova-test"), clock);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    @DisplayName("Should return the job result and record a duration sample")
    void testSuccess() {
        JobRunResult result = runner.run("pipeline", () -> 42);

        assertEquals(JobRunResult.Status.SUCCEEDED, result.status());
        assertEquals(42, result.result());
        assertEquals("pipeline", result.jobName());
        assertNotNull(result.runId());

        List<PerformanceSample> recorded = samples.findSince("pipeline", "duration_ms", clock.instant());
        assertEquals(1, recorded.size());
        assertEquals(1.0, registry.get("insightnova.job.runs").tag("job", "pipeline").tag("status", "success")
                .counter().count(), 1e-9);
    }

    @Test
    @DisplayName("Should report a thrown exception as FAILED without propagating it")
    void testFailure() {
        JobRunResult result = runner.run("stream", () -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(JobRunResult.Status.FAILED, result.status());
        assertNull(result.result());
        assertEquals(1.0, registry.get("insightnova.job.runs").tag("job", "stream").tag("status", "failure")
                .counter().count(), 1e-9);
        assertEquals(1, samples.size());
    }

    @Test
    @DisplayName("Should cancel a job that exceeds its timeout and release it for the next tick")
    void testTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        JobRunResult result = runner.run("slow", Duration.ofMillis(100), () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        });

        assertEquals(JobRunResult.Status.TIMED_OUT, result.status());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertEquals(1.0, registry.get("insightnova.job.timeouts").tag("job", "slow").counter().count(), 1e-9);
        awaitIdle("slow");
        assertEquals(JobRunResult.Status.SUCCEEDED, runner.run("slow", Duration.ofSeconds(5), () -> "ok").status());
    }

    @Test
    @DisplayName("Should keep skipping ticks until a timed-out job that ignores interruption has returned")
    void testTimedOutJobStillBlocksOverlap() throws Exception {
        CountDownLatch release = new CountDownLatch(1);

        JobRunResult result = runner.run("stubborn", Duration.ofMillis(100), () -> {
            while (true) {
                try {
                    if (release.await(10, TimeUnit.SECONDS)) {
                        return "late";
                    }
                } catch (InterruptedException ignored) {
                    // keep going, like a blocking socket read would
                }
            }
        });

        assertEquals(JobRunResult.Status.TIMED_OUT, result.status());
        assertTrue(runner.isRunning("stubborn"));
        assertEquals(JobRunResult.Status.SKIPPED, runner.run("stubborn", () -> "second").status());

        release.countDown();
        awaitIdle("stubborn");
        assertEquals(JobRunResult.Status.SUCCEEDED, runner.run("stubborn", () -> "third").status());
    }

    private void awaitIdle(String jobName) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (runner.isRunning(jobName) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(runner.isRunning(jobName));
    }

    @Test
    @DisplayName("Should skip a tick while the previous run of the same job is in progress")
    void testSkipsOverlappingRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<JobRunResult> first = CompletableFuture.supplyAsync(() ->
                runner.run("recommendations", Duration.ofSeconds(10), () -> {
                    started.countDown();
                    release.await(10, TimeUnit.SECONDS);
                    return "first";
                }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        JobRunResult second = runner.run("recommendations", () -> "second");
        JobRunResult other = runner.run("alerts", () -> "other");
        release.countDown();

        assertEquals(JobRunResult.Status.SKIPPED, second.status());
        assertEquals(JobRunResult.Status.SUCCEEDED, other.status());
        assertEquals("first", first.get(5, TimeUnit.SECONDS).result());
        assertFalse(runner.isRunning("recommendations"));
        assertEquals(1.0, registry.get("insightnova.job.skipped").tag("job", "recommendations").counter().count(), 1e-9);
    }

    @Test
    @DisplayName("Should expose jobId and runId in the MDC of the job thread only")
    void testMdcPropagation() {
        JobRunResult result = runner.run("baseline", () -> MDC.get(JobRunner.MDC_JOB_ID) + "/" + MDC.get(JobRunner.MDC_RUN_ID));

        assertEquals("baseline/" + result.runId(), result.result());
        assertNull(MDC.get(JobRunner.MDC_JOB_ID));
        assertNull(MDC.get(JobRunner.MDC_RUN_ID));
    }

    @Test
    @DisplayName("Should fall back to the default timeout for unknown jobs")
    void testTimeoutLookup() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getTimeouts().put("pipeline", Duration.ofSeconds(150));

        assertEquals(Duration.ofSeconds(150), properties.timeoutFor("pipeline"));
        assertEquals(Duration.ofMinutes(2), properties.timeoutFor("unknown"));
    }
}
