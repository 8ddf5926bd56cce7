package org.example.storybook.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Text provider backed by a local Ollama server (/api/generate, non-streaming).
 */
public class OllamaLlmProvider extends AbstractHttpLlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(2);

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        super(WebClient.builder().baseUrl(baseUrl).build(), model, timeoutSeconds);
        log.info("Ollama text provider ready: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    protected String endpoint() {
        return "/api/generate";
    }

    @Override
    protected Map<String, Object> buildRequest(String prompt, LlmOptions options) {
        Map<String, Object> sampling = new HashMap<>();
        sampling.put("temperature", options.temperature());
        if (options.topP() != null) {
            sampling.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            sampling.put("num_predict", options.maxTokens());
        }

        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("prompt", prompt);
        request.put("stream", false);
        request.put("options", sampling);
        if (options.hasSystemMessage()) {
            request.put("system", options.systemMessage());
        }
        return request;
    }

    @Override
    protected String extractText(JsonNode reply) {
        return reply.hasNonNull("response") ? reply.get("response").asText() : null;
    }

    /**
     * True when the server answers on /api/tags.
     */
    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(AVAILABILITY_TIMEOUT);
            return true;
        } catch (Exception e) {
            log.debug("Ollama not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
