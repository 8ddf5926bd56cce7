package org.example.storybook.config;

/**
 * Thrown at startup when a selected provider is missing required settings.
 */
public class ProviderConfigurationException extends RuntimeException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
