package com.di.insightnova.pipeline.validation;

import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.ai.gateway.ResponseParsers;
import com.di.insightnova.config.PipelineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Judges a staged payload against the expected schema and rates its quality through the
 * inference gateway: a schema verdict, a quality score, then issues and suggested fixes.
 * Gateway failures propagate so the caller can retry the stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataValidator {

    private final InferenceGateway gateway;
    private final PipelineProperties properties;

    public ValidationResult validate(JsonNode payload, String source) {
        String data = payload.toString();
        String schema = "required_fields = " + properties.getRequiredFields();

        boolean schemaValid = gateway.generateBool(String.format("""
                Validate this data against expected schema.
                Data: %s
                Expected schema: %s
                Source: %s
                Is the data valid?
                """, data, schema, source));

        double score = clamp(gateway.generateDouble(String.format("""
                Rate data quality from 0.0 to 1.0 based on completeness, accuracy and consistency.
                Data: %s
                """, data)));

        List<String> issues = ResponseParsers.splitLines(gateway.generate(String.format("""
                Identify specific data quality issues in this data, one per line.
                Data: %s
                Expected schema: %s
                """, data, schema)));

        List<String> fixes = ResponseParsers.splitLines(gateway.generate(String.format("""
                Suggest specific fixes for the data quality issues, one per line.
                Data: %s
                Issues: %s
                """, data, String.join("; ", issues))));

        ValidationResult result = ValidationResult.builder()
                .schemaValid(schemaValid)
                .score(score)
                .issues(issues)
                .fixes(fixes)
                .threshold(properties.getValidityThreshold())
                .build();
        log.debug("[VALIDATE] source={} schemaValid={} score={} issues={}", source, schemaValid, score, issues.size());
        return result;
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
