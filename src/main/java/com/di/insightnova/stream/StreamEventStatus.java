package com.di.insightnova.stream;

public enum StreamEventStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
