package org.example.storybook.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Shared request handling for JSON text providers. Subclasses build the request body for
 * their endpoint and pull the generated text out of the reply.
 */
public abstract class AbstractHttpLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpLlmProvider.class);

    protected final WebClient webClient;
    protected final String model;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    protected AbstractHttpLlmProvider(WebClient webClient, String model, int timeoutSeconds) {
        this.webClient = webClient;
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    protected abstract String endpoint();

    protected abstract Map<String, Object> buildRequest(String prompt, LlmOptions options);

    /**
     * @return the generated text, or null when the reply does not carry any
     */
    protected abstract String extractText(JsonNode reply);

    @Override
    public String generate(String prompt, LlmOptions options) {
        JsonNode reply = post(buildRequest(prompt, options));
        String text = extractText(reply);
        if (text == null) {
            throw new LlmProviderException(getProviderName() + " reply carries no generated text");
        }
        return text;
    }

    private JsonNode post(Map<String, Object> requestBody) {
        String providerName = getProviderName();
        String body;
        try {
            body = webClient.post()
                    .uri(endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("{} API error: {} - {}", providerName, e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException(providerName + " API error: " + e.getStatusCode(), e);
        } catch (WebClientRequestException e) {
            log.error("{} unreachable: {}", providerName, e.getMessage());
            throw new LlmProviderException(providerName + " request failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // block() rethrows a timeout wrapped in a RuntimeException
            log.error("{} request did not complete", providerName, e);
            throw new LlmProviderException(providerName + " request did not complete", e);
        }

        if (body == null || body.isBlank()) {
            throw new LlmProviderException(providerName + " returned an empty reply");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException(providerName + " returned a reply that is not JSON", e);
        }
    }
}
