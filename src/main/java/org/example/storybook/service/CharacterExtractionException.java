package org.example.storybook.service;

/**
 * Thrown when the model's character output cannot be parsed.
 */
public class CharacterExtractionException extends RuntimeException {

    public CharacterExtractionException(String message) {
        super(message);
    }

    public CharacterExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
