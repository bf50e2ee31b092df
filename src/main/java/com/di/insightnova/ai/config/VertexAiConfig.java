package com.di.insightnova.ai.config;

import com.di.insightnova.ai.gateway.SpringAiInferenceGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Spring AI configuration for Vertex AI / Gemini.
 *
 * <p>The Vertex AI starters create the {@link ChatModel} and {@link EmbeddingModel} beans; this
 * class wraps them into the {@link SpringAiInferenceGateway} that the rest of the service talks to.
 * Every call is a one-shot prompt, so the {@link ChatClient} carries no conversation memory.
 *
 * <p>Disabled entirely when {@code insightnova.ai.enabled=false}
 * (set {@code spring.ai.model.chat=none} and {@code spring.ai.model.embedding.text=none} as well so
 * the starters do not try to reach Vertex AI).
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "insightnova.ai.enabled", havingValue = "true", matchIfMissing = true)
public class VertexAiConfig {

    private final AiProperties aiProperties;

    @Value("classpath:prompts/system-prompt.st")
    private Resource systemPromptResource;

    @Bean(name = "statelessChatClient")
    public ChatClient statelessChatClient(ChatModel chatModel) {
        log.info("[AI-CONFIG] Initialising ChatClient → model={}, project={}, location={}",
                aiProperties.getChat().getModel(),
                aiProperties.getVertex().getProjectId(),
                aiProperties.getVertex().getLocation());
        return ChatClient.builder(chatModel)
                .defaultSystem(systemPromptResource)
                .build();
    }

    @Bean
    public SpringAiInferenceGateway springAiInferenceGateway(@Qualifier("statelessChatClient") ChatClient chatClient,
                                                             EmbeddingModel embeddingModel,
                                                             ObjectMapper objectMapper) {
        log.info("[AI-CONFIG] Inference gateway backed by Gemini, embeddings by {}",
                aiProperties.getEmbedding().getModel());
        return new SpringAiInferenceGateway(chatClient, embeddingModel, objectMapper, aiProperties);
    }
}
