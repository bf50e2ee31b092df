package com.di.insightnova.ai.config;

import com.di.insightnova.ai.gateway.GatewayActivityTracker;
import com.di.insightnova.ai.gateway.InferenceGateway;
import com.di.insightnova.ai.gateway.MeteredInferenceGateway;
import com.di.insightnova.ai.gateway.SpringAiInferenceGateway;
import com.di.insightnova.ai.gateway.UnavailableInferenceGateway;
import com.di.insightnova.performance.PerformanceSampleStore;
import com.di.insightnova.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Exposes the {@link InferenceGateway} every component injects: the Gemini-backed adapter when
 * AI is enabled, otherwise an adapter that always reports unavailability, wrapped for metrics.
 */
@Slf4j
@Configuration
public class InferenceGatewayConfig {

    @Bean
    @Primary
    public InferenceGateway inferenceGateway(ObjectProvider<SpringAiInferenceGateway> modelGateway,
                                             MetricsCollector metricsCollector,
                                             GatewayActivityTracker activityTracker,
                                             PerformanceSampleStore sampleStore,
                                             Clock clock) {
        InferenceGateway delegate = modelGateway.getIfAvailable();
        if (delegate == null) {
            log.warn("[AI-CONFIG] AI disabled: inference gateway will report every call as unavailable");
            delegate = new UnavailableInferenceGateway();
        }
        return new MeteredInferenceGateway(delegate, metricsCollector, activityTracker, sampleStore, clock);
    }
}
