package org.example.storybook.service;

import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Generates story text and splits it into pages.
 */
@Service
public class StoryGeneratorService {

    private static final Logger log = LoggerFactory.getLogger(StoryGeneratorService.class);

    private static final double STORY_TEMPERATURE = 0.8;
    // Tokens per word, padded for the model's own overshoot
    private static final double TOKEN_BUDGET_FACTOR = 1.5 * 1.5;
    static final int MIN_STORY_TOKENS = 1000;
    static final int MAX_STORY_TOKENS = 8000;

    private final LlmProvider storyProvider;
    private final PromptComposer promptComposer;
    private final SentencePaginator paginator;
    private final CharacterExtractionService characterExtractionService;

    public StoryGeneratorService(@Qualifier("storyLlmProvider") LlmProvider storyProvider,
                                 PromptComposer promptComposer,
                                 SentencePaginator paginator,
                                 CharacterExtractionService characterExtractionService) {
        this.storyProvider = storyProvider;
        this.promptComposer = promptComposer;
        this.paginator = paginator;
        this.characterExtractionService = characterExtractionService;
    }

    /**
     * Generate and paginate a new story. Characters are not extracted here; see
     * {@link #extractCharacters(List)}.
     *
     * @throws StoryGenerationException if the provider fails or returns no usable text
     */
    public Story generateStory(StoryMetadata metadata, String theme, String customPrompt) {
        String prompt = promptComposer.buildStoryPrompt(metadata, theme, customPrompt);
        int maxTokens = storyTokenBudget(metadata);

        log.info("Generating story '{}' with {}: {} pages, maxTokens={}",
                metadata.title(), storyProvider.getProviderName(), metadata.numPages(), maxTokens);

        String text;
        try {
            text = storyProvider.generate(prompt, LlmOptions.withTemperatureAndMaxTokens(STORY_TEMPERATURE, maxTokens));
        } catch (LlmProviderException e) {
            throw new StoryGenerationException("Story generation failed: " + e.getMessage(), e);
        }

        List<StoryPage> pages = paginator.paginate(text, metadata.numPages(), metadata.effectiveWordsPerPage());
        if (pages.isEmpty()) {
            throw new StoryGenerationException("Provider returned no story text for '" + metadata.title() + "'");
        }
        if (pages.size() < metadata.numPages()) {
            log.warn("Story '{}' filled {} of {} requested pages", metadata.title(), pages.size(), metadata.numPages());
        }

        Story story = new Story(UUID.randomUUID().toString(), metadata, pages);
        log.info("Generated story {} with {} pages", story.getId(), pages.size());
        return story;
    }

    /**
     * Profile the characters of a story. Unparseable model output or an unavailable analysis
     * provider yields an empty list.
     */
    public List<CharacterProfile> extractCharacters(List<StoryPage> pages) {
        if (pages == null || pages.isEmpty()) {
            return List.of();
        }
        try {
            return characterExtractionService.extractCharacterProfiles(pages);
        } catch (CharacterExtractionException e) {
            log.warn("Character extraction returned unusable output: {}", e.getMessage());
            return List.of();
        } catch (LlmProviderException e) {
            log.warn("Character extraction skipped, analysis provider failed: {}", e.getMessage());
            return List.of();
        }
    }

    static int storyTokenBudget(StoryMetadata metadata) {
        int estimate = (int) (metadata.numPages() * metadata.effectiveWordsPerPage() * TOKEN_BUDGET_FACTOR);
        return Math.max(MIN_STORY_TOKENS, Math.min(MAX_STORY_TOKENS, estimate));
    }
}
