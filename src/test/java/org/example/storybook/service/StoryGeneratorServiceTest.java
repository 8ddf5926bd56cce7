package org.example.storybook.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.config.StorybookProperties;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.example.storybook.service.llm.LlmProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoryGeneratorServiceTest {

    @Mock
    private LlmProvider storyProvider;

    @Mock
    private CharacterExtractionService characterExtractionService;

    private StoryGeneratorService service;

    @BeforeEach
    void setUp() {
        service = new StoryGeneratorService(
                storyProvider,
                new PromptComposer(new StorybookProperties()),
                new SentencePaginator(),
                characterExtractionService);
    }

    @Test
    void generateStory_paginatesProviderText() {
        when(storyProvider.getProviderName()).thenReturn("mock");
        when(storyProvider.generate(anyString(), any()))
                .thenReturn("Sir Cedric ran. He found a sword. He won the day.");

        Story story = service.generateStory(metadata(3, null), "bravery", null);

        assertNotNull(story.getId());
        assertEquals(3, story.getPages().size());
        assertEquals("He found a sword.", story.getPages().get(1).getText());
        assertTrue(story.getCharacters().isEmpty());
        assertNull(story.getImageSessionId());
    }

    @Test
    void generateStory_usesClampedTokenBudgetAndStoryTemperature() {
        when(storyProvider.getProviderName()).thenReturn("mock");
        when(storyProvider.generate(anyString(), any())).thenReturn("One. Two.");
        ArgumentCaptor<LlmOptions> options = ArgumentCaptor.forClass(LlmOptions.class);

        service.generateStory(metadata(2, null), null, null);

        verify(storyProvider).generate(anyString(), options.capture());
        assertEquals(0.8, options.getValue().temperature());
        assertEquals(1000, options.getValue().maxTokens());
    }

    @Test
    void storyTokenBudget_scalesWithPagesAndIsClamped() {
        assertEquals(1000, StoryGeneratorService.storyTokenBudget(metadata(2, 50)));
        assertEquals(2250, StoryGeneratorService.storyTokenBudget(metadata(10, 100)));
        assertEquals(8000, StoryGeneratorService.storyTokenBudget(metadata(40, 200)));
    }

    @Test
    void generateStory_emptyText_throws() {
        when(storyProvider.getProviderName()).thenReturn("mock");
        when(storyProvider.generate(anyString(), any())).thenReturn("  ");

        assertThrows(StoryGenerationException.class, () -> service.generateStory(metadata(3, null), null, null));
    }

    @Test
    void generateStory_providerFailure_wrapped() {
        when(storyProvider.getProviderName()).thenReturn("mock");
        when(storyProvider.generate(anyString(), any())).thenThrow(new LlmProviderException("timeout"));

        StoryGenerationException e = assertThrows(StoryGenerationException.class,
                () -> service.generateStory(metadata(3, null), null, null));
        assertInstanceOf(LlmProviderException.class, e.getCause());
    }

    @Test
    void generateStory_fewerPagesThanRequested_stillReturnsStory() {
        when(storyProvider.getProviderName()).thenReturn("mock");
        when(storyProvider.generate(anyString(), any())).thenReturn("Only one sentence.");

        Story story = service.generateStory(metadata(4, null), null, null);

        assertEquals(1, story.getPages().size());
    }

    @Test
    void extractCharacters_invalidModelOutput_returnsEmptyList() {
        List<StoryPage> pages = List.of(new StoryPage(1, "Pip napped."));
        when(characterExtractionService.extractCharacterProfiles(pages))
                .thenThrow(new CharacterExtractionException("bad json"));

        assertEquals(List.of(), service.extractCharacters(pages));
    }

    @Test
    void extractCharacters_analysisProviderDown_returnsEmptyList() {
        LlmProvider analysisProvider = mock(LlmProvider.class);
        when(analysisProvider.generate(anyString(), any())).thenThrow(new LlmProviderException("ollama down"));
        CharacterExtractionService extraction = new CharacterExtractionService(analysisProvider, new ObjectMapper());
        ReflectionTestUtils.setField(extraction, "maxCharacters", 6);
        ReflectionTestUtils.setField(extraction, "maxStoryChars", 6000);
        StoryGeneratorService generator = new StoryGeneratorService(storyProvider,
                new PromptComposer(new StorybookProperties()), new SentencePaginator(), extraction);

        List<CharacterProfile> characters = generator.extractCharacters(List.of(new StoryPage(1, "Pip napped.")));

        assertEquals(List.of(), characters);
    }

    @Test
    void extractCharacters_returnsProfiles() {
        List<StoryPage> pages = List.of(new StoryPage(1, "Pip napped."));
        CharacterProfile pip = new CharacterProfile("Pip", "Cat", "grey cat", null, null, null);
        when(characterExtractionService.extractCharacterProfiles(pages)).thenReturn(List.of(pip));

        assertEquals(List.of(pip), service.extractCharacters(pages));
    }

    private StoryMetadata metadata(int pages, Integer wordsPerPage) {
        return new StoryMetadata("The Knight", "English", "simple", "basic", "4-6",
                pages, wordsPerPage, "adventure", "cartoon", null);
    }
}
