package org.example.storybook.config;

import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.OllamaLlmProvider;
import org.example.storybook.service.llm.OpenAiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for text generation providers.
 * The story provider writes narratives; the analysis provider handles character
 * extraction and scene summaries and defaults to the story provider's settings.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    // Story provider config
    @Value("${ai.text.provider:ollama}")
    private String storyProvider;

    @Value("${ai.text.timeout-seconds:180}")
    private int storyTimeoutSeconds;

    @Value("${ai.text.ollama.base-url:http://localhost:11434}")
    private String storyOllamaBaseUrl;

    @Value("${ai.text.ollama.model:llama3.1:latest}")
    private String storyOllamaModel;

    @Value("${ai.text.openai.base-url:https://api.openai.com/v1}")
    private String storyOpenAiBaseUrl;

    @Value("${ai.text.openai.api-key:}")
    private String storyOpenAiApiKey;

    @Value("${ai.text.openai.model:gpt-4o-mini}")
    private String storyOpenAiModel;

    // Analysis provider config (defaults to the story provider)
    @Value("${ai.analysis.provider:${ai.text.provider:ollama}}")
    private String analysisProvider;

    @Value("${ai.analysis.timeout-seconds:${ai.text.timeout-seconds:180}}")
    private int analysisTimeoutSeconds;

    @Value("${ai.analysis.ollama.base-url:${ai.text.ollama.base-url:http://localhost:11434}}")
    private String analysisOllamaBaseUrl;

    @Value("${ai.analysis.ollama.model:${ai.text.ollama.model:llama3.1:latest}}")
    private String analysisOllamaModel;

    @Value("${ai.analysis.openai.base-url:${ai.text.openai.base-url:https://api.openai.com/v1}}")
    private String analysisOpenAiBaseUrl;

    @Value("${ai.analysis.openai.api-key:${ai.text.openai.api-key:}}")
    private String analysisOpenAiApiKey;

    @Value("${ai.analysis.openai.model:${ai.text.openai.model:gpt-4o-mini}}")
    private String analysisOpenAiModel;

    @Bean
    @Qualifier("storyLlmProvider")
    public LlmProvider storyLlmProvider() {
        log.info("Configuring story LLM provider: {}", storyProvider);
        return createProvider(
                storyProvider,
                storyOllamaBaseUrl, storyOllamaModel,
                storyOpenAiBaseUrl, storyOpenAiApiKey, storyOpenAiModel,
                storyTimeoutSeconds,
                "story"
        );
    }

    @Bean
    @Qualifier("analysisLlmProvider")
    public LlmProvider analysisLlmProvider() {
        log.info("Configuring analysis LLM provider: {}", analysisProvider);
        return createProvider(
                analysisProvider,
                analysisOllamaBaseUrl, analysisOllamaModel,
                analysisOpenAiBaseUrl, analysisOpenAiApiKey, analysisOpenAiModel,
                analysisTimeoutSeconds,
                "analysis"
        );
    }

    LlmProvider createProvider(
            String providerType,
            String ollamaBaseUrl, String ollamaModel,
            String openAiBaseUrl, String openAiApiKey, String openAiModel,
            int timeoutSeconds,
            String purpose) {

        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                log.info("Creating Ollama provider for {}: baseUrl={}, model={}",
                        purpose, ollamaBaseUrl, ollamaModel);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
            case "openai" -> {
                if (openAiApiKey == null || openAiApiKey.isBlank()) {
                    throw new ProviderConfigurationException(
                            "OpenAI selected for " + purpose + " provider but no API key is configured");
                }
                log.info("Creating OpenAI provider for {}: model={}", purpose, openAiModel);
                yield new OpenAiLlmProvider(openAiBaseUrl, openAiApiKey, openAiModel, timeoutSeconds);
            }
            default -> throw new ProviderConfigurationException(
                    "Unknown text provider '" + providerType + "' for " + purpose);
        };
    }
}
