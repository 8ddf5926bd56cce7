package org.example.storybook.service.image;

/**
 * Multi-turn image generation provider. Implementations hold no per-story state:
 * the caller owns the session token and passes it on every turn.
 */
public interface ImageConversationClient {

    /**
     * Open a new conversation primed with the story's art direction.
     *
     * @return the initial session token
     * @throws ImageProviderException if the provider rejects the request
     */
    String startSession(String storyId, String artStyle, String storyTitle);

    /**
     * Generate one image inside an existing conversation.
     *
     * @return the image reference and the (possibly rotated) session token
     * @throws ImageProviderException if generation fails after retries
     */
    ImageTurn generateImage(String storyId, String sessionToken, String prompt,
                            ImageSize size, ImageQuality quality);

    /**
     * Check whether a previously issued session token is still usable.
     */
    boolean validateSession(String storyId, String sessionToken);

    String getProviderName();
}
