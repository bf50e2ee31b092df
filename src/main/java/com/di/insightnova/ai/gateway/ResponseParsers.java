package com.di.insightnova.ai.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model text into typed answers. Anything that does not parse is reported as empty and
 * the gateway converts that into {@link InferenceUnavailableException}.
 */
public final class ResponseParsers {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?(?:[eE][-+]?\\d+)?");

    private ResponseParsers() {
    }

    public static Optional<Boolean> parseBoolean(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", " ").trim();
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        String first = normalized.split("\\s+")[0];
        switch (first) {
            case "true":
            case "yes":
                return Optional.of(Boolean.TRUE);
            case "false":
            case "no":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    /** First number in the text. */
    public static OptionalDouble parseDouble(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(m.group()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Parses {@code [{"value":..,"lower":..,"upper":..}, ...]} (optionally wrapped in prose or a
     * code fence). Timestamps continue the series at its last observed step.
     *
     * @throws InferenceUnavailableException when no well-formed array is found
     */
    public static List<ForecastPoint> parseForecast(ObjectMapper mapper, String text,
                                                    List<SeriesPoint> series, int horizon) {
        if (text == null) {
            throw new InferenceUnavailableException("Empty forecast response");
        }
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new InferenceUnavailableException("Forecast response is not a JSON array");
        }
        JsonNode array;
        try {
            array = mapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new InferenceUnavailableException("Malformed forecast JSON: " + e.getOriginalMessage(), e);
        }

        Instant last = series.get(series.size() - 1).timestamp();
        Duration step = series.size() > 1
                ? Duration.between(series.get(series.size() - 2).timestamp(), last)
                : Duration.ofMinutes(5);

        List<ForecastPoint> points = new ArrayList<>();
        for (int i = 0; i < array.size() && points.size() < horizon; i++) {
            JsonNode node = array.get(i);
            if (!node.hasNonNull("value")) {
                continue;
            }
            double value = node.get("value").asDouble();
            double lower = node.path("lower").asDouble(value);
            double upper = node.path("upper").asDouble(value);
            points.add(new ForecastPoint(last.plus(step.multipliedBy(i + 1L)), value, lower, upper));
        }
        if (points.isEmpty()) {
            throw new InferenceUnavailableException("Forecast response contained no points");
        }
        return points;
    }

    /** Splits a model answer into non-blank lines with list markers removed. */
    public static List<String> splitLines(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String line : text.split("\\r?\\n")) {
            String cleaned = line.trim().replaceFirst("^([-*•]|\\d+[.)])\\s*", "").trim();
            if (!cleaned.isEmpty()) {
                out.add(cleaned);
            }
        }
        return out;
    }
}
