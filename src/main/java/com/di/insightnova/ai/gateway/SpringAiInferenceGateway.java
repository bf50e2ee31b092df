package com.di.insightnova.ai.gateway;

import com.di.insightnova.ai.config.AiProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * {@link InferenceGateway} backed by Spring AI: Gemini through a stateless {@link ChatClient} for
 * generation, judgments and forecasts, and the Vertex AI {@link EmbeddingModel} for vectors.
 * Any client failure or unparseable answer surfaces as {@link InferenceUnavailableException}.
 */
@Slf4j
@RequiredArgsConstructor
public class SpringAiInferenceGateway implements InferenceGateway {

    private final ChatClient chatClient;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final AiProperties aiProperties;

    @Override
    public String generate(String prompt) {
        String answer = call("generate", prompt);
        if (answer == null || answer.isBlank()) {
            throw new InferenceUnavailableException("Empty generation response");
        }
        return answer.trim();
    }

    @Override
    public boolean generateBool(String prompt) {
        String answer = call("generate_bool", prompt + "\n\nAnswer with exactly one word: true or false.");
        return ResponseParsers.parseBoolean(answer)
                .orElseThrow(() -> new InferenceUnavailableException("Not a boolean answer: " + abbreviate(answer)));
    }

    @Override
    public double generateDouble(String prompt) {
        String answer = call("generate_double", prompt + "\n\nAnswer with a single number only.");
        return ResponseParsers.parseDouble(answer)
                .orElseThrow(() -> new InferenceUnavailableException("Not a numeric answer: " + abbreviate(answer)));
    }

    @Override
    public float[] generateEmbedding(String text) {
        try {
            float[] vector = embeddingModel.embed(truncate(text));
            if (vector == null || vector.length == 0) {
                throw new InferenceUnavailableException("Empty embedding");
            }
            return vector;
        } catch (InferenceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceUnavailableException("Embedding call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ForecastPoint> forecast(List<SeriesPoint> series, int horizon, double confidence) {
        if (series == null || series.isEmpty()) {
            throw new InferenceUnavailableException("Cannot forecast an empty series");
        }
        String observed = series.stream()
                .map(p -> p.timestamp() + " " + String.format(Locale.ROOT, "%.2f", p.value()))
                .collect(Collectors.joining("\n"));
        String prompt = String.format(Locale.ROOT, """
                You are a time-series forecaster. Given the observed points below (timestamp value, oldest first),
                forecast the next %d points at the same spacing with a %.0f%% prediction interval.
                Respond only with a JSON array of objects: [{"value": number, "lower": number, "upper": number}]

                Observed:
                %s
                """, horizon, confidence * 100, observed);
        return ResponseParsers.parseForecast(objectMapper, call("forecast", prompt), series, horizon);
    }

    // ------------------------------------------------------------------ //

    private String call(String operation, String prompt) {
        try {
            return chatClient.prompt()
                    .user(truncate(prompt))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            log.warn("[GATEWAY] {} failed: {}", operation, e.getMessage());
            throw new InferenceUnavailableException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private String truncate(String text) {
        int max = aiProperties.getGateway().getMaxPromptChars();
        if (text == null || max <= 0 || text.length() <= max) {
            return text;
        }
        return text.substring(0, max);
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() > 80 ? s.substring(0, 80) + "…" : s;
    }
}
