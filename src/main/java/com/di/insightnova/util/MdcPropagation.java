package com.di.insightnova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Propagates SLF4J MDC ({@code jobId}, {@code runId}, {@code requestId}) to executor threads so
 * that logs written by a job running on the {@link com.di.insightnova.scheduler.JobRunner} pool
 * carry the same correlation keys as the thread that dispatched it.
 * <p>
 * Usage: {@code executor.submit(MdcPropagation.wrapCallable(() -> doWork()));}
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of
     * the task and removes those keys in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Same as {@link #wrapRunnable(Runnable)} for a {@link Callable}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
