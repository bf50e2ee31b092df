package com.di.insightnova.ai.gateway;

import java.time.Instant;

public record SeriesPoint(Instant timestamp, double value) {
}
