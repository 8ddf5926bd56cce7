package org.example.storybook.service.llm;

/**
 * Exception thrown when a text generation provider fails.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
