package org.example.storybook.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Text provider for OpenAI-compatible chat completion APIs (/chat/completions).
 * The system message, when set, goes first in the message list.
 */
public class OpenAiLlmProvider extends AbstractHttpLlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmProvider.class);

    private final boolean keyConfigured;

    public OpenAiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        super(WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build(), model, timeoutSeconds);
        this.keyConfigured = apiKey != null && !apiKey.isBlank();
        log.info("OpenAI text provider ready: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    protected String endpoint() {
        return "/chat/completions";
    }

    @Override
    protected Map<String, Object> buildRequest(String prompt, LlmOptions options) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (options.hasSystemMessage()) {
            messages.add(Map.of("role", "system", "content", options.systemMessage()));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("messages", messages);
        request.put("temperature", options.temperature());
        if (options.topP() != null) {
            request.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            request.put("max_tokens", options.maxTokens());
        }
        return request;
    }

    @Override
    protected String extractText(JsonNode reply) {
        JsonNode content = reply.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    @Override
    public boolean isAvailable() {
        if (!keyConfigured) {
            log.debug("OpenAI text provider has no API key");
        }
        return keyConfigured;
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
