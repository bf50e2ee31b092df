package com.di.insightnova.pipeline.enrichment;

import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.ai.gateway.ResponseParsers;
import com.di.insightnova.pipeline.staging.Enrichment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Adds context to a validated payload: enriched text, key entities and categories.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataEnricher {

    private final InferenceGateway gateway;
    private final Clock clock;

    public Enrichment enrich(JsonNode payload, List<String> sources) {
        String data = payload.toString();
        String context = String.join(", ", sources);

        String content = gateway.generate(String.format("""
                Enrich this data with additional context from the following sources: %s
                Data: %s
                Return the enriched description as plain text.
                """, context, data));

        List<String> entities = ResponseParsers.splitLines(gateway.generate(String.format("""
                Extract key entities (people, organisations, products, locations, metrics) from this data, one per line.
                Data: %s
                """, data)));

        List<String> categories = ResponseParsers.splitLines(gateway.generate(String.format("""
                Categorize and tag this data with business categories, one per line.
                Data: %s
                """, data)));

        log.debug("[ENRICH] entities={} categories={}", entities.size(), categories.size());
        return Enrichment.builder()
                .content(content)
                .entities(entities)
                .categories(categories)
                .sourcesUsed(List.copyOf(sources))
                .enrichedAt(clock.instant())
                .build();
    }
}
