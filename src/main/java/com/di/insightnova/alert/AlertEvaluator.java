package com.di.insightnova.alert;

import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.ai.gateway.ResponseParsers;
import com.di.insightnova.ai.gateway.SeriesPoint;
import com.di.insightnova.config.PipelineProperties;
import com.di.insightnova.insight.Urgency;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Decides whether content or a time series deserves an alert, and writes the alert text.
 *
 * <p>Significance needs both the model's yes/no verdict and a score at or above the threshold,
 * so a confident "yes" with a weak score is not enough.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEvaluator {

    private final InferenceGateway gateway;
    private final PipelineProperties properties;

    public SignificanceAssessment evaluate(String content, String context) {
        boolean verdict = gateway.generateBool(String.format("""
                Determine if this data represents a significant business event that requires attention.
                Data: %s
                Context: %s
                """, content, context));

        double score = clamp(gateway.generateDouble(String.format("""
                Rate the business significance of this event from 0.0 to 1.0.
                Data: %s
                """, content)));

        boolean significant = verdict && score >= config().getSignificanceThreshold();
        if (!significant) {
            return SignificanceAssessment.builder().significant(false).score(score).build();
        }

        String explanation = gateway.generate(String.format("""
                Explain briefly why this event is significant for the business.
                Data: %s
                """, content));
        String action = gateway.generate(String.format("""
                Recommend one specific action to take in response to this event.
                Data: %s
                """, content));

        return SignificanceAssessment.builder()
                .significant(true)
                .score(score)
                .explanation(explanation)
                .recommendedAction(action)
                .build();
    }

    /**
     * Writes the alert message for a significant trigger. Urgency is re-derived from the
     * significance score, not copied from the source insight.
     */
    public ComposedAlert compose(String triggerContent, SignificanceAssessment assessment, AlertAudience audience) {
        String message = gateway.generate(String.format("""
                Generate a clear, actionable alert message for this event.
                Event: %s
                Why it matters: %s
                Recommended action: %s
                """, triggerContent, assessment.getExplanation(), assessment.getRecommendedAction()));

        String personalized = gateway.generate(String.format("""
                Personalize this alert for a %s working on %s.
                Alert: %s
                """, audience.role(), String.join(", ", audience.activeProjects()), message));

        return ComposedAlert.builder()
                .message(message)
                .urgency(Urgency.fromScore(assessment.getScore()))
                .personalizedMessage(personalized)
                .build();
    }

    public AnomalyAssessment detectAnomaly(List<SeriesPoint> series, String context) {
        String data = series.stream()
                .map(p -> p.timestamp() + " " + String.format(Locale.ROOT, "%.2f", p.value()))
                .collect(Collectors.joining("\n"));

        boolean anomaly = gateway.generateBool(String.format("""
                Analyze this time series data for anomalies.
                Series (%s):
                %s
                Does it contain an anomaly?
                """, context, data));
        if (!anomaly) {
            return AnomalyAssessment.builder().anomalyDetected(false).confidence(0.0).investigationSteps(List.of()).build();
        }

        String description = gateway.generate(String.format("""
                Describe any anomalies in this time series (%s):
                %s
                """, context, data));
        double confidence = clamp(gateway.generateDouble(String.format("""
                Rate confidence in anomaly detection from 0.0 to 1.0.
                Anomaly: %s
                """, description)));
        List<String> steps = ResponseParsers.splitLines(gateway.generate(String.format("""
                Suggest specific investigation steps for this anomaly, one per line.
                Anomaly: %s
                """, description)));

        return AnomalyAssessment.builder()
                .anomalyDetected(true)
                .description(description)
                .confidence(confidence)
                .investigationSteps(steps)
                .build();
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private PipelineProperties.AlertConfig config() {
        return properties.getAlerts();
    }
}
