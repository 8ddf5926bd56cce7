package org.example.storybook.service.image;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Image conversation client for the OpenAI Responses API with the image_generation tool.
 * Each reply carries a new response id which becomes the session token for the next turn
 * (sent back as previous_response_id).
 */
public class OpenAiImageConversationClient implements ImageConversationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiImageConversationClient.class);
    private static final int MAX_RESPONSE_BYTES = 32 * 1024 * 1024;

    private final WebClient webClient;
    private final String model;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiImageConversationClient(String baseUrl, String apiKey, String model,
                                         int timeoutSeconds, int maxAttempts, long baseDelayMs) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                        .build())
                .build();
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = Duration.ofMillis(baseDelayMs);
        log.info("OpenAI image conversation client initialized: model={}, maxAttempts={}", model, this.maxAttempts);
    }

    @Override
    public String startSession(String storyId, String artStyle, String storyTitle) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", buildSessionPrimer(artStyle, storyTitle));

        ResponsesReply reply = postResponses(requestBody, "start session for story " + storyId);
        if (reply.id() == null || reply.id().isBlank()) {
            throw new ImageProviderException("OpenAI returned no response id when starting a session", false);
        }
        log.info("Started image session for story {}: {}", storyId, reply.id());
        return reply.id();
    }

    @Override
    public ImageTurn generateImage(String storyId, String sessionToken, String prompt,
                                   ImageSize size, ImageQuality quality) {
        Map<String, Object> tool = new HashMap<>();
        tool.put("type", "image_generation");
        tool.put("size", size.wireValue());
        tool.put("quality", quality.wireValue());

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", prompt);
        requestBody.put("tools", List.of(tool));
        if (sessionToken != null && !sessionToken.isBlank()) {
            requestBody.put("previous_response_id", sessionToken);
        }

        ResponsesReply reply = postResponses(requestBody, "generate image for story " + storyId);
        String imageReference = extractImageReference(reply);
        String nextToken = reply.id() != null && !reply.id().isBlank() ? reply.id() : sessionToken;
        log.debug("Generated image for story {} ({} {}), session {} -> {}",
                storyId, size.wireValue(), quality.wireValue(), sessionToken, nextToken);
        return new ImageTurn(imageReference, nextToken);
    }

    @Override
    public boolean validateSession(String storyId, String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return false;
        }
        try {
            webClient.get()
                    .uri("/responses/{id}", sessionToken)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return true;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                log.info("Image session {} for story {} is no longer valid: {}",
                        sessionToken, storyId, e.getStatusCode());
                return false;
            }
            throw classify(e, "validate session for story " + storyId);
        } catch (RuntimeException e) {
            throw classify(e, "validate session for story " + storyId);
        }
    }

    @Override
    public String getProviderName() {
        return "openai";
    }

    private ResponsesReply postResponses(Map<String, Object> requestBody, String operation) {
        String response = webClient.post()
                .uri("/responses")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(e -> classify(e, operation))
                .retryWhen(Retry.backoff(maxAttempts - 1, baseDelay)
                        .jitter(0d)
                        .filter(e -> e instanceof ImageProviderException ipe && ipe.isRetryable())
                        .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}/{}): {}",
                                operation, signal.totalRetries() + 2, maxAttempts, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .block();

        if (response == null || response.isBlank()) {
            throw new ImageProviderException("Empty response from OpenAI while trying to " + operation, false);
        }
        try {
            return objectMapper.readValue(response, ResponsesReply.class);
        } catch (JsonProcessingException e) {
            throw new ImageProviderException("Unreadable response from OpenAI while trying to " + operation, false, e);
        }
    }

    String extractImageReference(ResponsesReply reply) {
        List<ResponseOutputItem> output = reply.output() != null ? reply.output() : List.of();
        for (ResponseOutputItem item : output) {
            if (item instanceof ResponseOutputItem.ImageGenerationCall call
                    && call.result() != null && !call.result().isBlank()) {
                return toImageReference(call.result());
            }
        }
        // Fallback: some replies carry the image as message content instead of a tool call
        for (ResponseOutputItem item : output) {
            if (item instanceof ResponseOutputItem.Message message && message.content() != null) {
                for (ResponseOutputItem.ContentItem content : message.content()) {
                    if (content.isImage()) {
                        return content.url();
                    }
                }
            }
        }
        throw new ImageProviderException("No image found in OpenAI response " + reply.id(), false);
    }

    static String toImageReference(String result) {
        if (result.startsWith("http://") || result.startsWith("https://") || result.startsWith("data:")) {
            return result;
        }
        return "data:image/png;base64," + result;
    }

    private ImageProviderException classify(Throwable error, String operation) {
        if (error instanceof ImageProviderException ipe) {
            return ipe;
        }
        if (error instanceof WebClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || e.getStatusCode().is5xxServerError();
            log.error("OpenAI API error while trying to {}: {} - {}", operation, e.getStatusCode(), e.getResponseBodyAsString());
            return new ImageProviderException("OpenAI API error: " + e.getStatusCode(), retryable, e);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            log.warn("Transient failure while trying to {}: {}", operation, error.getMessage());
            return new ImageProviderException("OpenAI request failed: " + error.getMessage(), true, error);
        }
        return new ImageProviderException("Failed to " + operation, false, error);
    }

    private String buildSessionPrimer(String artStyle, String storyTitle) {
        return String.format("""
            You are illustrating a children's picture book and will produce every image for it in this conversation.
            Art style: %s
            Story: %s

            Keep one consistent visual style for the whole book. Characters must look the same in every image:
            same proportions, colors, clothing and distinctive features.

            You will be asked for, in order:
            1. An art bible image that sets the palette, lighting and rendering technique.
            2. A reference sheet for each main character.
            3. One illustration per page, which must match the art bible and the character sheets.

            Reply with a short acknowledgement now. Do not generate an image yet.
            """, artStyle, storyTitle != null ? storyTitle : "Untitled");
    }
}
