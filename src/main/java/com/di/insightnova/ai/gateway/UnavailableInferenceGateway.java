package com.di.insightnova.ai.gateway;

import java.util.List;

/**
 * Wired when {@code insightnova.ai.enabled=false}. Every call fails, so pipeline stages retry and
 * eventually park their items for review instead of inventing answers.
 */
public class UnavailableInferenceGateway implements InferenceGateway {

    private static final String MESSAGE = "Inference service disabled (insightnova.ai.enabled=false)";

    @Override
    public String generate(String prompt) {
        throw new InferenceUnavailableException(MESSAGE);
    }

    @Override
    public boolean generateBool(String prompt) {
        throw new InferenceUnavailableException(MESSAGE);
    }

    @Override
    public double generateDouble(String prompt) {
        throw new InferenceUnavailableException(MESSAGE);
    }

    @Override
    public float[] generateEmbedding(String text) {
        throw new InferenceUnavailableException(MESSAGE);
    }

    @Override
    public List<ForecastPoint> forecast(List<SeriesPoint> series, int horizon, double confidence) {
        throw new InferenceUnavailableException(MESSAGE);
    }
}
