package com.di.insightnova.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Strongly-typed binding for all {@code insightnova.ai.*} properties.
 *
 * <pre>
 * insightnova:
 *   ai:
 *     enabled: true
 *     vertex:
 *       project-id: my-gcp-project
 *       location:   us-central1
 *     chat:
 *       model: gemini-2.0-flash-001
 *     gateway:
 *       max-prompt-chars: 8000
 * </pre>
 *
 * Model parameters themselves are read by the Spring AI starter from
 * {@code spring.ai.vertex.ai.gemini.*}; the values here are reported at startup and used by
 * the gateway adapter.
 */
@Data
@ConfigurationProperties(prefix = "insightnova.ai")
public class AiProperties {

    /** Master switch. With false, every gateway call reports the inference service as unavailable. */
    private boolean enabled = true;

    @NestedConfigurationProperty
    private VertexConfig vertex = new VertexConfig();

    @NestedConfigurationProperty
    private ChatConfig chat = new ChatConfig();

    @NestedConfigurationProperty
    private EmbeddingConfig embedding = new EmbeddingConfig();

    @NestedConfigurationProperty
    private GatewayConfig gateway = new GatewayConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class VertexConfig {
        private String projectId = "your-gcp-project-id";
        private String location  = "us-central1";
    }

    @Data
    public static class ChatConfig {
        private String model       = "gemini-2.0-flash-001";
        private double temperature = 0.3;
    }

    @Data
    public static class EmbeddingConfig {
        private String model                = "text-embedding-004";
        private int    outputDimensionality = 768;
    }

    @Data
    public static class GatewayConfig {
        /** Payload text beyond this length is cut before it is embedded in a prompt. */
        private int maxPromptChars = 8000;
    }
}
