package org.example.storybook.service.llm;

/**
 * Options for text generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,          // nullable
    Integer maxTokens,    // nullable
    String systemMessage  // nullable
) {
    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null, null);
    }

    public static LlmOptions withTemperatureAndMaxTokens(double temp, int maxTokens) {
        return new LlmOptions(temp, null, maxTokens, null);
    }

    public LlmOptions withSystemMessage(String message) {
        return new LlmOptions(temperature, topP, maxTokens, message);
    }

    public boolean hasSystemMessage() {
        return systemMessage != null && !systemMessage.isBlank();
    }
}
