package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.Project;
import org.example.storybook.model.ProjectStatus;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.repository.InMemoryProjectRepository;
import org.example.storybook.service.llm.LlmProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectOrchestratorTest {

    @Mock
    private StoryGeneratorService storyGenerator;

    @Mock
    private VisualContextOrchestrator visualContext;

    private InMemoryProjectRepository repository;
    private ProjectOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        repository = new InMemoryProjectRepository();
        orchestrator = new ProjectOrchestrator(storyGenerator, visualContext, repository);
    }

    @Test
    void createProject_generatesIllustratesAndSaves() {
        Story story = story("story-1", 2);
        when(storyGenerator.generateStory(any(), any(), any())).thenReturn(story);
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(illustrating(1, 2));

        Project project = orchestrator.createProject(metadata("Moon Kite"), "courage", null);

        assertEquals(ProjectStatus.COMPLETED, project.getStatus());
        assertEquals("Moon Kite", project.getName());
        assertSame(story, project.getStory());
        assertSame(project, repository.findById(project.getId()).orElseThrow());
        verify(storyGenerator, never()).extractCharacters(any());
    }

    @Test
    void createProject_partialImages_markedImagesGenerated() {
        Story story = story("story-1", 3);
        when(storyGenerator.generateStory(any(), any(), any())).thenReturn(story);
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(illustrating(1));

        Project project = orchestrator.createProject(metadata("Moon Kite"), null, null);

        assertEquals(ProjectStatus.IMAGES_GENERATED, project.getStatus());
    }

    @Test
    void createProject_withVisualContext_buildsReferencesBeforePages() {
        Story story = story("story-1", 1);
        CharacterProfile pip = new CharacterProfile("Pip", "Cat", "grey cat", null, null, null);
        when(storyGenerator.generateStory(any(), any(), any())).thenReturn(story);
        when(storyGenerator.extractCharacters(story.getPages())).thenReturn(List.of(pip));
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(illustrating(1));

        Project project = orchestrator.createProject(metadata("Moon Kite"), null, null,
                true, GenerationCancellation.none());

        assertEquals(List.of(pip), project.getStory().getCharacters());
        InOrder inOrder = inOrder(visualContext);
        inOrder.verify(visualContext).generateArtBibleImage(story);
        inOrder.verify(visualContext).generateCharacterReferences(story);
        inOrder.verify(visualContext).generateImagesForStory(eq(story), any());
    }

    @Test
    void createProject_visualContextFailure_stillIllustratesPages() {
        Story story = story("story-1", 1);
        when(storyGenerator.generateStory(any(), any(), any())).thenReturn(story);
        when(storyGenerator.extractCharacters(story.getPages())).thenReturn(List.of());
        when(visualContext.generateArtBibleImage(story)).thenThrow(new IllegalStateException("provider down"));
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(illustrating(1));

        Project project = orchestrator.createProject(metadata("Moon Kite"), null, null,
                true, GenerationCancellation.none());

        assertEquals(ProjectStatus.COMPLETED, project.getStatus());
        verify(visualContext, never()).generateCharacterReferences(any());
    }

    @Test
    void createProject_extractionProviderFailure_stillIllustratesPages() {
        Story story = story("story-1", 2);
        when(storyGenerator.generateStory(any(), any(), any())).thenReturn(story);
        when(storyGenerator.extractCharacters(story.getPages()))
                .thenThrow(new LlmProviderException("ollama down"));
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(illustrating(1, 2));

        Project project = orchestrator.createProject(metadata("Moon Kite"), null, null,
                true, GenerationCancellation.none());

        assertEquals(ProjectStatus.COMPLETED, project.getStatus());
        assertTrue(project.getStory().getCharacters().isEmpty());
        verify(visualContext).generateImagesForStory(eq(story), any());
    }

    @Test
    void regenerateStory_keepsIdsAndArtBibleButDropsCharactersAndSession() {
        Story original = story("story-1", 2);
        ArtBible artBible = new ArtBible("bible prompt", "cartoon", "p", "l", "t", null);
        artBible.setImageUrl("https://img/bible.png");
        original.setArtBible(artBible);
        original.setCharacters(List.of(new CharacterProfile("Pip", "Cat", "grey cat", null, null, null)));
        original.setCharacterReferences(List.of(new CharacterReference("Pip", "sheet")));
        original.setImageSessionId("resp_old");
        Project project = repository.save(new Project("project-1", "Old", original));

        Story fresh = story("story-2", 3);
        when(storyGenerator.generateStory(any(), any(), any())).thenReturn(fresh);
        when(visualContext.generateImagesForStory(eq(original), any())).thenAnswer(illustrating(1, 2, 3));

        Project result = orchestrator.regenerateStory("project-1", metadata("New Title"), null, "new idea");

        assertSame(project, result);
        Story story = result.getStory();
        assertEquals("story-1", story.getId());
        assertEquals(3, story.getPages().size());
        assertEquals("New Title", story.getMetadata().title());
        assertTrue(story.getCharacters().isEmpty());
        assertTrue(story.getCharacterReferences().isEmpty());
        assertSame(artBible, story.getArtBible());
        assertNull(artBible.getImageUrl());
        verify(visualContext).clearSession(original);
        assertEquals(ProjectStatus.COMPLETED, result.getStatus());
    }

    @Test
    void regenerateImages_reusesPersistedStory() {
        Story story = story("story-1", 2);
        repository.save(new Project("project-1", "Kite", story));
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(illustrating(1, 2));

        Project project = orchestrator.regenerateImages("project-1");

        assertEquals(ProjectStatus.COMPLETED, project.getStatus());
        verify(storyGenerator, never()).generateStory(any(), any(), any());
    }

    @Test
    void regenerateImages_pageFailingOnRerun_marksImagesGenerated() {
        Story story = story("story-1", 3);
        story.getPages().forEach(page -> page.setImageUrl("https://img/old-" + page.getPageNumber() + ".png"));
        Project project = new Project("project-1", "Kite", story);
        project.setStatus(ProjectStatus.COMPLETED);
        repository.save(project);
        when(visualContext.generateImagesForStory(eq(story), any())).thenAnswer(invocation -> {
            Story target = invocation.getArgument(0);
            target.findPage(2).orElseThrow().setImageUrl(null);
            return 2;
        });

        Project result = orchestrator.regenerateImages("project-1");

        assertEquals(ProjectStatus.IMAGES_GENERATED, result.getStatus());
    }

    @Test
    void regenerateImages_noPageIllustrated_keepsStatus() {
        Story story = story("story-1", 2);
        Project project = new Project("project-1", "Kite", story);
        project.setStatus(ProjectStatus.STORY_GENERATED);
        repository.save(project);
        when(visualContext.generateImagesForStory(eq(story), any())).thenReturn(0);

        assertEquals(ProjectStatus.STORY_GENERATED, orchestrator.regenerateImages("project-1").getStatus());
    }

    @Test
    void regenerateImages_cancelled_stillSavesProgress() {
        Story story = story("story-1", 2);
        Project project = new Project("project-1", "Kite", story);
        repository.save(project);
        when(visualContext.generateImagesForStory(eq(story), any()))
                .thenThrow(new GenerationCancelledException("cancelled"));

        assertThrows(GenerationCancelledException.class, () -> orchestrator.regenerateImages("project-1"));
        assertEquals(ProjectStatus.DRAFT, repository.findById("project-1").orElseThrow().getStatus());
    }

    @Test
    void extractCharacters_storesProfilesOnStory() {
        Story story = story("story-1", 1);
        repository.save(new Project("project-1", "Kite", story));
        CharacterProfile pip = new CharacterProfile("Pip", "Cat", "grey cat", null, null, null);
        when(storyGenerator.extractCharacters(story.getPages())).thenReturn(List.of(pip));

        List<CharacterProfile> characters = orchestrator.extractCharacters("project-1");

        assertEquals(List.of(pip), characters);
        assertEquals(List.of(pip), story.getCharacters());
    }

    @Test
    void getProject_missing_throws() {
        assertThrows(ProjectNotFoundException.class, () -> orchestrator.getProject("nope"));
    }

    @Test
    void deleteProject_removesProjectAndReleasesStory() {
        Story story = story("story-1", 1);
        repository.save(new Project("project-1", "Kite", story));

        orchestrator.deleteProject("project-1");

        assertTrue(repository.findById("project-1").isEmpty());
        verify(visualContext).releaseStory(story);
    }

    private static Answer<Integer> illustrating(int... pageNumbers) {
        return invocation -> {
            Story story = invocation.getArgument(0);
            for (int pageNumber : pageNumbers) {
                story.findPage(pageNumber).orElseThrow().setImageUrl("https://img/page-" + pageNumber + ".png");
            }
            return pageNumbers.length;
        };
    }

    private StoryMetadata metadata(String title) {
        return new StoryMetadata(title, "English", "simple", "basic", "4-6", 2, 50, null, "cartoon", null);
    }

    private Story story(String id, int pageCount) {
        List<StoryPage> pages = new ArrayList<>();
        for (int i = 1; i <= pageCount; i++) {
            pages.add(new StoryPage(i, "Page " + i + "."));
        }
        return new Story(id, metadata("Kite"), pages);
    }
}
