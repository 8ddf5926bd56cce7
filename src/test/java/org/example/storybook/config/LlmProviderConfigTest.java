package org.example.storybook.config;

import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.OllamaLlmProvider;
import org.example.storybook.service.llm.OpenAiLlmProvider;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class LlmProviderConfigTest {

    private final LlmProviderConfig config = new LlmProviderConfig();

    @Test
    void createProvider_ollama() {
        LlmProvider provider = config.createProvider("Ollama",
                "http://localhost:11434", "llama3.1:latest",
                "https://api.openai.com/v1", "", "gpt-4o-mini", 30, "story");

        assertInstanceOf(OllamaLlmProvider.class, provider);
        assertEquals("ollama", provider.getProviderName());
    }

    @Test
    void createProvider_openAiWithKey() {
        LlmProvider provider = config.createProvider("openai",
                "http://localhost:11434", "llama3.1:latest",
                "https://api.openai.com/v1", "sk-test", "gpt-4o-mini", 30, "analysis");

        assertInstanceOf(OpenAiLlmProvider.class, provider);
    }

    @Test
    void createProvider_openAiWithoutKey_fails() {
        ProviderConfigurationException e = assertThrows(ProviderConfigurationException.class,
                () -> config.createProvider("openai",
                        "http://localhost:11434", "llama3.1:latest",
                        "https://api.openai.com/v1", " ", "gpt-4o-mini", 30, "analysis"));
        assertTrue(e.getMessage().contains("analysis"));
    }

    @Test
    void createProvider_unknownType_fails() {
        assertThrows(ProviderConfigurationException.class,
                () -> config.createProvider("claude-local",
                        "http://localhost:11434", "llama3.1:latest",
                        "https://api.openai.com/v1", "", "gpt-4o-mini", 30, "story"));
    }

    @Test
    void analysisProvider_usesItsOwnSettings() {
        ReflectionTestUtils.setField(config, "analysisProvider", "openai");
        ReflectionTestUtils.setField(config, "analysisTimeoutSeconds", 60);
        ReflectionTestUtils.setField(config, "analysisOllamaBaseUrl", "http://localhost:11434");
        ReflectionTestUtils.setField(config, "analysisOllamaModel", "llama3.1:latest");
        ReflectionTestUtils.setField(config, "analysisOpenAiBaseUrl", "https://api.openai.com/v1");
        ReflectionTestUtils.setField(config, "analysisOpenAiApiKey", "sk-analysis");
        ReflectionTestUtils.setField(config, "analysisOpenAiModel", "gpt-4o-mini");

        assertEquals("openai", config.analysisLlmProvider().getProviderName());
    }
}
