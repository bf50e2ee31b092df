package com.di.insightnova.ai.gateway;

import java.time.Instant;

/**
 * One forecast step with its prediction interval.
 */
public record ForecastPoint(Instant timestamp, double value, double lower, double upper) {
}
