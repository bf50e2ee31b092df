package com.di.insightnova.ai.gateway;

import java.util.List;

/**
 * Port to the external inference service. Every method either returns a usable answer or throws
 * {@link InferenceUnavailableException}; callers never receive fabricated defaults.
 */
public interface InferenceGateway {

    /** Free-text generation. */
    String generate(String prompt);

    /** Yes/no judgment. */
    boolean generateBool(String prompt);

    /** Numeric judgment, e.g. a score in [0,1]; callers clamp. */
    double generateDouble(String prompt);

    /** Text embedding vector. */
    float[] generateEmbedding(String text);

    /**
     * Forecasts the next {@code horizon} points of a time series.
     *
     * @param series     observed points, oldest first (at least one point)
     * @param horizon    number of future points
     * @param confidence prediction-interval confidence, e.g. 0.8
     */
    List<ForecastPoint> forecast(List<SeriesPoint> series, int horizon, double confidence);
}
