package com.di.insightnova.scheduler;

import com.di.insightnova.aspect.ErrorCategory;
import com.di.insightnova.performance.PerformanceSample;
import com.di.insightnova.performance.PerformanceSampleStore;
import com.di.insightnova.util.JobEventLogger;
import com.di.insightnova.util.MdcPropagation;
import com.di.insightnova.util.MetricsCollector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs scheduled jobs on a bounded pool with a per-job timeout. A job never overlaps with its own
 * previous run: a tick that finds the job still running is skipped. On timeout the future is
 * cancelled with interruption; the job stays marked as running until its task has actually
 * returned, so a body stuck in non-interruptible I/O keeps later ticks out.
 *
 * <p>Each run gets MDC {@code jobId}/{@code runId}, a duration timer, a
 * {@code <job>/duration_ms} performance sample and a structured JOB event.
 */
@Slf4j
@Component
public class JobRunner {

    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_RUN_ID = "runId";
    static final String DURATION_METRIC = "duration_ms";

    private final ExecutorService executor;
    private final Map<String, AtomicReference<String>> running = new ConcurrentHashMap<>();
    private final SchedulerProperties properties;
    private final MetricsCollector metricsCollector;
    private final PerformanceSampleStore sampleStore;
    private final JobEventLogger eventLogger;
    private final Clock clock;

    public JobRunner(SchedulerProperties properties, MetricsCollector metricsCollector,
                     PerformanceSampleStore sampleStore, JobEventLogger eventLogger, Clock clock) {
        this.properties = properties;
        this.metricsCollector = metricsCollector;
        this.sampleStore = sampleStore;
        this.eventLogger = eventLogger;
        this.clock = clock;
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "insightnova-job-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getPoolSize()), tf);
    }

    public JobRunResult run(String jobName, Callable<?> task) {
        return run(jobName, properties.timeoutFor(jobName), task);
    }

    public JobRunResult run(String jobName, Duration timeout, Callable<?> task) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        AtomicReference<String> owner = running.computeIfAbsent(jobName, k -> new AtomicReference<>());
        if (!owner.compareAndSet(null, runId)) {
            metricsCollector.recordJobSkipped(jobName);
            log.warn("[JOB] {} still running, skipping this tick", jobName);
            return new JobRunResult(jobName, runId, JobRunResult.Status.SKIPPED, 0, null);
        }

        MDC.put(MDC_JOB_ID, jobName);
        MDC.put(MDC_RUN_ID, runId);
        long start = System.nanoTime();
        JobRunResult.Status status = JobRunResult.Status.FAILED;
        Object result = null;
        Throwable failure = null;
        Future<?> future = null;
        AtomicBoolean started = new AtomicBoolean(false);
        Callable<Object> body = () -> {
            started.set(true);
            try {
                return task.call();
            } finally {
                owner.compareAndSet(runId, null);
            }
        };
        try {
            future = executor.submit(MdcPropagation.wrapCallable(body));
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            status = JobRunResult.Status.SUCCEEDED;
        } catch (TimeoutException e) {
            future.cancel(true);
            status = JobRunResult.Status.TIMED_OUT;
            failure = e;
            metricsCollector.recordJobTimeout(jobName);
            log.error("[JOB] {} timed out after {}, cancelled", jobName, timeout);
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
            log.error("[JOB] {} failed", jobName, failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            failure = e;
            log.warn("[JOB] {} interrupted while waiting", jobName);
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (future == null || (future.isCancelled() && !started.get())) {
                // never ran, so nothing else will release it
                owner.compareAndSet(runId, null);
            }
            finish(jobName, runId, status, durationMs, result, failure);
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_RUN_ID);
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        return new JobRunResult(jobName, runId, status, durationMs, result);
    }

    /** True while a run of {@code jobName} is still executing, including a cancelled one. */
    public boolean isRunning(String jobName) {
        AtomicReference<String> owner = running.get(jobName);
        return owner != null && owner.get() != null;
    }

    private void finish(String jobName, String runId, JobRunResult.Status status, long durationMs,
                        Object result, Throwable failure) {
        boolean success = status == JobRunResult.Status.SUCCEEDED;
        metricsCollector.recordJobRun(jobName, durationMs, success);
        sampleStore.record(PerformanceSample.builder()
                .component(jobName)
                .metric(DURATION_METRIC)
                .value(durationMs)
                .recordedAt(clock.instant())
                .build());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("job", jobName);
        context.put("status", status.name());
        context.put("durationMs", durationMs);
        if (success) {
            if (result != null) {
                context.put("result", String.valueOf(result));
            }
            eventLogger.logEvent("JOB_COMPLETED", context, runId, jobName);
            log.debug("[JOB] {} completed in {} ms", jobName, durationMs);
        } else {
            context.put("errorCategory", ErrorCategory.categorize(failure).name());
            eventLogger.logEvent("JOB_FAILED", context, runId, jobName, failure);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("[JOB] Job executor did not terminate within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
