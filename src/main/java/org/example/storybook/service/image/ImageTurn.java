package org.example.storybook.service.image;

/**
 * Result of one image conversation turn.
 *
 * @param imageReference URL or data URL of the generated image
 * @param sessionToken the session token to use for the next turn (providers may rotate it)
 */
public record ImageTurn(String imageReference, String sessionToken) {}
