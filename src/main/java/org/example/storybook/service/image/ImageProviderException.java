package org.example.storybook.service.image;

/**
 * Exception thrown when an image provider call fails. Transient failures
 * (timeouts, connection errors, 429 and 5xx responses) are flagged retryable.
 */
public class ImageProviderException extends RuntimeException {

    private final boolean retryable;

    public ImageProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ImageProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
