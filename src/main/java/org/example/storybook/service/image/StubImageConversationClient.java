package org.example.storybook.service.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Offline image client returning placeholder URLs. Used for development and when no
 * image provider is configured.
 */
public class StubImageConversationClient implements ImageConversationClient {

    private static final Logger log = LoggerFactory.getLogger(StubImageConversationClient.class);
    private static final String TOKEN_PREFIX = "stub-session-";

    private final AtomicInteger imageCounter = new AtomicInteger();

    @Override
    public String startSession(String storyId, String artStyle, String storyTitle) {
        String token = TOKEN_PREFIX + UUID.randomUUID();
        log.debug("Stub session {} started for story {}", token, storyId);
        return token;
    }

    @Override
    public ImageTurn generateImage(String storyId, String sessionToken, String prompt,
                                   ImageSize size, ImageQuality quality) {
        int n = imageCounter.incrementAndGet();
        String[] dimensions = size.wireValue().split("x");
        String url = String.format("https://placehold.co/%sx%s/png?text=Image+%d", dimensions[0], dimensions[1], n);
        return new ImageTurn(url, sessionToken);
    }

    @Override
    public boolean validateSession(String storyId, String sessionToken) {
        return sessionToken != null && sessionToken.startsWith(TOKEN_PREFIX);
    }

    @Override
    public String getProviderName() {
        return "stub";
    }
}
