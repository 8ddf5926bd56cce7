package org.example.storybook.service.session;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory map from story id to its image conversation token and whether the visual
 * context (art bible and character references) has been established in that conversation.
 * Not persisted: callers keep {@code Story.imageSessionId} as the durable copy.
 */
@Component
public class ConversationSessionStore {

    private record SessionEntry(String token, boolean initialized) {}

    private final ConcurrentMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();

    public Optional<String> get(String storyId) {
        SessionEntry entry = sessions.get(storyId);
        return entry == null ? Optional.empty() : Optional.of(entry.token());
    }

    /**
     * Store a token. A rotated token keeps the initialized flag of the entry it replaces.
     */
    public void set(String storyId, String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Session token must not be blank");
        }
        sessions.compute(storyId, (id, existing) ->
                new SessionEntry(token, existing != null && existing.initialized()));
    }

    public void clear(String storyId) {
        sessions.remove(storyId);
    }

    public boolean isInitialized(String storyId) {
        SessionEntry entry = sessions.get(storyId);
        return entry != null && entry.initialized();
    }

    /**
     * Mark the story's context as established. No effect when no token is stored.
     */
    public void markInitialized(String storyId) {
        sessions.computeIfPresent(storyId, (id, existing) -> new SessionEntry(existing.token(), true));
    }
}
