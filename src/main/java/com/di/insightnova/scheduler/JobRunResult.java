package com.di.insightnova.scheduler;

/**
 * Outcome of one dispatched job run. {@code result} is null unless the run succeeded.
 */
public record JobRunResult(String jobName, String runId, Status status, long durationMs, Object result) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        /** The previous run of the same job was still in progress. */
        SKIPPED
    }
}
