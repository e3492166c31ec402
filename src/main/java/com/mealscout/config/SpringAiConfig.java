package com.mealscout.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Spring AI wiring for the vision model that describes place photos.
 *
 * <p>{@link AiProperties#getMode()} decides which {@link ChatModel} is used. Both the OpenAI
 * and Ollama starters contribute their model beans, so the routing bean only picks one.
 * Provider settings stay in {@code spring.ai.openai.*} and {@code spring.ai.ollama.*}.</p>
 */
@Configuration
@EnableConfigurationProperties({AiProperties.class, ChatProperties.class, IntegrationProperties.class})
@Slf4j
public class SpringAiConfig {

    private final AiProperties properties;

    public SpringAiConfig(AiProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Primary
    public ChatModel routingChatModel(
            ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
            ObjectProvider<OllamaChatModel> ollamaChatModelProvider) {
        AiProperties.Mode mode = properties.getMode();
        log.info("Configuring vision chat model for mode={}", mode);
        return switch (mode) {
            case OPENAI -> openAiChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("OpenAI mode selected but OpenAiChatModel bean is missing. " +
                        "Ensure spring-ai-openai starter is on the classpath and configured.");
            });
            case OLLAMA -> ollamaChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("Ollama mode selected but OllamaChatModel bean is missing. " +
                        "Ensure spring-ai-ollama starter is on the classpath and configured.");
            });
        };
    }

    @Bean
    public ChatClient visionChatClient(ChatModel chatModel) {
        String model = properties.getVision().getDescribeModel();
        log.info("Vision chat client default model={}", model);
        return ChatClient.builder(chatModel)
                .defaultOptions(ChatOptions.builder()
                        .model(model)
                        .maxTokens(properties.getVision().getMaxTokens())
                        .build())
                .build();
    }
}
