package org.example.storybook.service.llm;

/**
 * Abstraction for text generation providers (Ollama, OpenAI-compatible APIs).
 */
public interface LlmProvider {

    /**
     * Generate text for a prompt.
     *
     * @param prompt the user prompt
     * @param options sampling options and optional system message
     * @return the generated text
     * @throws LlmProviderException if the provider call fails
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is configured and reachable.
     */
    boolean isAvailable();

    /**
     * Provider name for logging, e.g. "ollama" or "openai".
     */
    String getProviderName();
}
