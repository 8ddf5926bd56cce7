package org.example.storybook.config;

import org.example.storybook.service.image.ImageConversationClient;
import org.example.storybook.service.image.OpenAiImageConversationClient;
import org.example.storybook.service.image.StubImageConversationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ImageConversationConfig {

    private static final Logger log = LoggerFactory.getLogger(ImageConversationConfig.class);

    @Value("${ai.image.provider:stub}")
    private String imageProvider;

    @Value("${ai.image.timeout-seconds:300}")
    private int timeoutSeconds;

    @Value("${ai.image.openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${ai.image.openai.api-key:}")
    private String openAiApiKey;

    @Value("${ai.image.openai.model:gpt-4.1-mini}")
    private String openAiModel;

    @Value("${ai.image.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${ai.image.retry.base-delay-ms:2000}")
    private long retryBaseDelayMs;

    @Bean
    public ImageConversationClient imageConversationClient() {
        return switch (imageProvider.toLowerCase()) {
            case "stub" -> {
                log.warn("Using stub image provider: pages will get placeholder images");
                yield new StubImageConversationClient();
            }
            case "openai" -> {
                if (openAiApiKey == null || openAiApiKey.isBlank()) {
                    throw new ProviderConfigurationException(
                            "OpenAI image provider selected but ai.image.openai.api-key is not set");
                }
                log.info("Creating OpenAI image provider: model={}, retry max-attempts={}, base-delay={}ms",
                        openAiModel, retryMaxAttempts, retryBaseDelayMs);
                yield new OpenAiImageConversationClient(openAiBaseUrl, openAiApiKey, openAiModel,
                        timeoutSeconds, retryMaxAttempts, retryBaseDelayMs);
            }
            default -> throw new ProviderConfigurationException("Unknown image provider '" + imageProvider + "'");
        };
    }
}
