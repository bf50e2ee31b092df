package com.di.insightnova.pipeline.task;

public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    RETRYING;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
