package org.example.storybook.service;

import org.example.storybook.config.StorybookProperties;
import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.image.ImageConversationClient;
import org.example.storybook.service.image.ImageQuality;
import org.example.storybook.service.image.ImageSize;
import org.example.storybook.service.image.ImageTurn;
import org.example.storybook.service.session.ConversationSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps each story's image conversation usable and generates images inside it.
 *
 * <p>Session states per story: no session, a persisted token that has not been validated
 * yet, and an initialized context (art bible and character references replayed into the
 * conversation). {@link #ensureSession} moves a story to the initialized state at most once
 * per load; {@link #clearSession} returns it to no session.
 *
 * <p>All session transitions for one story are serialized on a per-story lock. Pages of
 * one story are generated sequentially.
 */
@Service
public class VisualContextOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VisualContextOrchestrator.class);

    private final ImageConversationClient imageClient;
    private final ConversationSessionStore sessionStore;
    private final SceneSummarizer sceneSummarizer;
    private final PromptComposer promptComposer;
    private final StorybookProperties properties;

    private final ConcurrentMap<String, Object> storyLocks = new ConcurrentHashMap<>();

    private record PageIllustration(String imageReference, String prompt) {}

    public VisualContextOrchestrator(ImageConversationClient imageClient,
                                     ConversationSessionStore sessionStore,
                                     SceneSummarizer sceneSummarizer,
                                     PromptComposer promptComposer,
                                     StorybookProperties properties) {
        this.imageClient = imageClient;
        this.sessionStore = sessionStore;
        this.sceneSummarizer = sceneSummarizer;
        this.promptComposer = promptComposer;
        this.properties = properties;
    }

    public String ensureSession(Story story) {
        return ensureSession(story, GenerationCancellation.none());
    }

    /**
     * Return a session token whose conversation holds the story's visual context,
     * validating a persisted token or rebuilding the context when needed.
     */
    public String ensureSession(Story story, GenerationCancellation cancellation) {
        String storyId = story.getId();
        synchronized (lockFor(storyId)) {
            Optional<String> current = sessionStore.get(storyId);
            if (current.isPresent() && sessionStore.isInitialized(storyId)) {
                return current.get();
            }

            cancellation.throwIfCancelled(storyId);
            String persisted = story.getImageSessionId();
            if (hasText(persisted)) {
                if (current.isEmpty()) {
                    sessionStore.set(storyId, persisted);
                }
                String candidate = sessionStore.get(storyId).orElse(persisted);
                if (isSessionValid(storyId, candidate)) {
                    sessionStore.markInitialized(storyId);
                    story.setImageSessionId(candidate);
                    log.info("Resumed image session {} for story {}", candidate, storyId);
                    return candidate;
                }
                log.info("Image session {} for story {} is no longer valid, rebuilding visual context",
                        candidate, storyId);
            }

            return rebuildVisualContext(story, cancellation);
        }
    }

    public String rebuildVisualContext(Story story) {
        return rebuildVisualContext(story, GenerationCancellation.none());
    }

    /**
     * Start a fresh conversation and replay the art bible and character references into it.
     * Art bible and reference failures are logged and skipped; a failure to start the
     * session propagates.
     */
    public String rebuildVisualContext(Story story, GenerationCancellation cancellation) {
        String storyId = story.getId();
        synchronized (lockFor(storyId)) {
            sessionStore.clear(storyId);
            cancellation.throwIfCancelled(storyId);

            String token = imageClient.startSession(storyId, story.getArtStyle(), storyTitle(story));
            sessionStore.set(storyId, token);
            story.setImageSessionId(token);
            log.info("Rebuilding visual context for story {} in session {}", storyId, token);

            StorybookProperties.Images images = properties.getImages();
            ArtBible artBible = story.getArtBible();
            if (artBible != null && hasText(artBible.getPrompt())) {
                cancellation.throwIfCancelled(storyId);
                try {
                    ImageTurn turn = turn(story, artBible.getPrompt(),
                            images.getArtBibleSize(), images.getArtBibleQuality());
                    artBible.setImageUrl(turn.imageReference());
                } catch (GenerationCancelledException e) {
                    throw e;
                } catch (Exception e) {
                    log.error("Failed to regenerate art bible for story {}", storyId, e);
                }
            }

            for (CharacterReference reference : story.getCharacterReferences()) {
                if (!hasText(reference.getPrompt())) {
                    continue;
                }
                cancellation.throwIfCancelled(storyId);
                try {
                    ImageTurn turn = turn(story, reference.getPrompt(),
                            images.effectiveCharacterReferenceSize(), images.getCharacterReferenceQuality());
                    reference.setImageUrl(turn.imageReference());
                } catch (GenerationCancelledException e) {
                    throw e;
                } catch (Exception e) {
                    log.error("Failed to regenerate character reference '{}' for story {}",
                            reference.getCharacterName(), storyId, e);
                }
            }

            String finalToken = sessionStore.get(storyId).orElse(token);
            sessionStore.markInitialized(storyId);
            story.setImageSessionId(finalToken);
            return finalToken;
        }
    }

    /**
     * Open a new conversation without replaying any visual context.
     */
    public String startNewSession(Story story) {
        String storyId = story.getId();
        synchronized (lockFor(storyId)) {
            sessionStore.clear(storyId);
            String token = imageClient.startSession(storyId, story.getArtStyle(), storyTitle(story));
            sessionStore.set(storyId, token);
            sessionStore.markInitialized(storyId);
            story.setImageSessionId(token);
            log.info("Started new image session {} for story {}", token, storyId);
            return token;
        }
    }

    public void clearSession(Story story) {
        synchronized (lockFor(story.getId())) {
            sessionStore.clear(story.getId());
            story.setImageSessionId(null);
        }
        log.info("Cleared image session for story {}", story.getId());
    }

    /**
     * Drop everything held for a story that will not be generated again: its session and its lock.
     */
    public void releaseStory(Story story) {
        clearSession(story);
        storyLocks.remove(story.getId());
    }

    int trackedStoryCount() {
        return storyLocks.size();
    }

    public String generateImageForPage(Story story, String sceneText, List<CharacterProfile> characters,
                                       String artStyle, ImageSize size, ImageQuality quality) {
        return generateImageForPage(story, sceneText, characters, artStyle, size, quality,
                GenerationCancellation.none());
    }

    /**
     * Illustrate one page inside the story's conversation.
     *
     * @return the image reference; the caller writes it onto the page
     */
    public String generateImageForPage(Story story, String sceneText, List<CharacterProfile> characters,
                                       String artStyle, ImageSize size, ImageQuality quality,
                                       GenerationCancellation cancellation) {
        return illustrate(story, sceneText, characters, artStyle, size, quality, cancellation).imageReference();
    }

    /**
     * Illustrate a page with a prompt supplied by the user, sent as-is.
     */
    public String generateImageForPageWithPrompt(Story story, int pageNumber, String customPrompt) {
        StoryPage page = story.findPage(pageNumber)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Story " + story.getId() + " has no page " + pageNumber));
        if (!hasText(customPrompt)) {
            throw new IllegalArgumentException("Custom prompt must not be blank");
        }
        ensureSession(story);
        StorybookProperties.Images images = properties.getImages();
        ImageTurn turn = turn(story, customPrompt, images.getPageSize(), images.getPageQuality());
        page.setImageUrl(turn.imageReference());
        page.setImagePrompt(customPrompt);
        story.touch();
        return turn.imageReference();
    }

    public int generateImagesForStory(Story story) {
        return generateImagesForStory(story, GenerationCancellation.none());
    }

    /**
     * Illustrate every page in page order. A failed page is logged and left without an image.
     *
     * @return number of pages illustrated
     * @throws GenerationCancelledException if cancelled between pages; finished pages keep their images
     */
    public int generateImagesForStory(Story story, GenerationCancellation cancellation) {
        StorybookProperties.Images images = properties.getImages();
        List<StoryPage> pages = new ArrayList<>(story.getPages());
        pages.sort(Comparator.comparingInt(StoryPage::getPageNumber));

        log.info("Generating images for {} pages of story {}", pages.size(), story.getId());
        int illustrated = 0;
        for (StoryPage page : pages) {
            cancellation.throwIfCancelled(story.getId());
            try {
                PageIllustration illustration = illustrate(story, page.getText(), story.getCharacters(),
                        story.getArtStyle(), images.getPageSize(), images.getPageQuality(), cancellation);
                page.setImageUrl(illustration.imageReference());
                page.setImagePrompt(illustration.prompt());
                illustrated++;
                log.info("Illustrated page {}/{} of story {}", page.getPageNumber(), pages.size(), story.getId());
            } catch (GenerationCancelledException e) {
                throw e;
            } catch (Exception e) {
                // An image from an earlier run no longer matches this run's context
                page.setImageUrl(null);
                page.setImagePrompt(null);
                log.error("Failed to illustrate page {} of story {}", page.getPageNumber(), story.getId(), e);
            }
        }
        story.touch();
        log.info("Story {}: {} of {} pages illustrated", story.getId(), illustrated, pages.size());
        return illustrated;
    }

    /**
     * Generate the art bible image inside the story's conversation, creating the art bible
     * from the story metadata when the story has none.
     */
    public ArtBible generateArtBibleImage(Story story) {
        ensureSession(story);
        ArtBible artBible = story.getArtBible();
        if (artBible == null) {
            String genre = story.getMetadata() != null ? story.getMetadata().genre() : null;
            artBible = promptComposer.createArtBible(story.getArtStyle(), genre, storyTitle(story), null);
            story.setArtBible(artBible);
        }
        StorybookProperties.Images images = properties.getImages();
        ImageTurn turn = turn(story, artBible.getPrompt(), images.getArtBibleSize(), images.getArtBibleQuality());
        artBible.setImageUrl(turn.imageReference());
        story.touch();
        return artBible;
    }

    /**
     * Create references for profiled characters that have none and generate the missing
     * reference images. A failed character is logged and skipped.
     */
    public List<CharacterReference> generateCharacterReferences(Story story) {
        ensureSession(story);
        StorybookProperties.Images images = properties.getImages();

        List<CharacterReference> references = new ArrayList<>(story.getCharacterReferences());
        for (CharacterProfile profile : story.getCharacters()) {
            if (profile.hasName() && findReference(references, profile.name()).isEmpty()) {
                references.add(promptComposer.createCharacterReference(
                        profile, story.getArtStyle(), images.isCharacterTurnaround()));
            }
        }
        story.setCharacterReferences(references);

        for (CharacterReference reference : story.getCharacterReferences()) {
            if (hasText(reference.getImageUrl()) || !hasText(reference.getPrompt())) {
                continue;
            }
            try {
                ImageTurn turn = turn(story, reference.getPrompt(),
                        images.effectiveCharacterReferenceSize(), images.getCharacterReferenceQuality());
                reference.setImageUrl(turn.imageReference());
            } catch (Exception e) {
                log.error("Failed to generate character reference '{}' for story {}",
                        reference.getCharacterName(), story.getId(), e);
            }
        }
        story.touch();
        return story.getCharacterReferences();
    }

    private PageIllustration illustrate(Story story, String sceneText, List<CharacterProfile> characters,
                                        String artStyle, ImageSize size, ImageQuality quality,
                                        GenerationCancellation cancellation) {
        ensureSession(story, cancellation);
        String summary = sceneSummarizer.summarize(sceneText, characters);
        String prompt = hasEstablishedContext(story)
                ? promptComposer.composeConversationPrompt(summary, artStyle)
                : promptComposer.composeImagePrompt(summary, characters, artStyle,
                        story.getArtBible(), story.getCharacterReferences());
        cancellation.throwIfCancelled(story.getId());
        ImageTurn turn = turn(story, prompt, size, quality);
        return new PageIllustration(turn.imageReference(), prompt);
    }

    /**
     * One provider turn with the current token. A rotated token is stored immediately so a
     * later failure cannot leave a stale token behind.
     */
    private ImageTurn turn(Story story, String prompt, ImageSize size, ImageQuality quality) {
        String storyId = story.getId();
        synchronized (lockFor(storyId)) {
            String token = sessionStore.get(storyId).orElse(story.getImageSessionId());
            ImageTurn turn = imageClient.generateImage(storyId, token, prompt, size, quality);
            if (hasText(turn.sessionToken()) && !turn.sessionToken().equals(token)) {
                sessionStore.set(storyId, turn.sessionToken());
                story.setImageSessionId(turn.sessionToken());
            }
            return turn;
        }
    }

    private boolean isSessionValid(String storyId, String token) {
        try {
            return imageClient.validateSession(storyId, token);
        } catch (Exception e) {
            log.warn("Could not validate image session {} for story {}: {}", token, storyId, e.getMessage());
            return false;
        }
    }

    /**
     * The conversation already shows the characters and style when the art bible or a
     * character reference has an image in it.
     */
    private boolean hasEstablishedContext(Story story) {
        if (story.getArtBible() != null && hasText(story.getArtBible().getImageUrl())) {
            return true;
        }
        return story.getCharacterReferences().stream().anyMatch(ref -> hasText(ref.getImageUrl()));
    }

    private Optional<CharacterReference> findReference(List<CharacterReference> references, String name) {
        return references.stream()
                .filter(ref -> ref.getCharacterName() != null && ref.getCharacterName().equalsIgnoreCase(name))
                .findFirst();
    }

    private Object lockFor(String storyId) {
        return storyLocks.computeIfAbsent(storyId, id -> new Object());
    }

    private static String storyTitle(Story story) {
        return story.getMetadata() != null ? story.getMetadata().title() : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
