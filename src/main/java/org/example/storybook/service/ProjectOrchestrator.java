package org.example.storybook.service;

import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.Project;
import org.example.storybook.model.ProjectStatus;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Runs the full pipeline for a project: story text, pagination, illustrations and persistence.
 */
@Service
public class ProjectOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProjectOrchestrator.class);

    private final StoryGeneratorService storyGenerator;
    private final VisualContextOrchestrator visualContext;
    private final ProjectRepository projectRepository;

    public ProjectOrchestrator(StoryGeneratorService storyGenerator,
                               VisualContextOrchestrator visualContext,
                               ProjectRepository projectRepository) {
        this.storyGenerator = storyGenerator;
        this.visualContext = visualContext;
        this.projectRepository = projectRepository;
    }

    public Project createProject(StoryMetadata metadata, String theme, String customPrompt) {
        return createProject(metadata, theme, customPrompt, false, GenerationCancellation.none());
    }

    /**
     * Generate, illustrate and store a new story.
     *
     * @param establishVisualContext generate the art bible, profile the characters and generate
     *                               their reference sheets before the pages are illustrated
     */
    public Project createProject(StoryMetadata metadata, String theme, String customPrompt,
                                 boolean establishVisualContext, GenerationCancellation cancellation) {
        Story story = storyGenerator.generateStory(metadata, theme, customPrompt);
        Project project = new Project(UUID.randomUUID().toString(), metadata.title(), story);
        project.setStatus(ProjectStatus.STORY_GENERATED);
        projectRepository.save(project);
        log.info("Created project {} for story {}", project.getId(), story.getId());

        if (establishVisualContext) {
            try {
                story.setCharacters(storyGenerator.extractCharacters(story.getPages()));
                cancellation.throwIfCancelled(story.getId());
                visualContext.generateArtBibleImage(story);
                if (!story.getCharacters().isEmpty()) {
                    cancellation.throwIfCancelled(story.getId());
                    visualContext.generateCharacterReferences(story);
                }
            } catch (GenerationCancelledException e) {
                throw e;
            } catch (Exception e) {
                log.error("Failed to establish visual context for story {}, illustrating without it",
                        story.getId(), e);
            }
            projectRepository.save(project);
        }

        illustrate(project, cancellation);
        return project;
    }

    /**
     * Replace the story text of an existing project. Project and story ids are kept.
     * Characters, character references and the image session described the old text
     * and are dropped; the art bible is kept but its image is regenerated.
     */
    public Project regenerateStory(String projectId, StoryMetadata metadata, String theme, String customPrompt) {
        Project project = getProject(projectId);
        Story story = project.getStory();

        Story fresh = storyGenerator.generateStory(metadata, theme, customPrompt);
        visualContext.clearSession(story);
        story.setMetadata(metadata);
        story.setPages(fresh.getPages());
        story.setCharacters(List.of());
        story.setCharacterReferences(List.of());
        ArtBible artBible = story.getArtBible();
        if (artBible != null) {
            artBible.setImageUrl(null);
        }
        story.touch();
        project.setName(metadata.title());
        project.setStatus(ProjectStatus.STORY_GENERATED);
        projectRepository.save(project);
        log.info("Regenerated story {} for project {}", story.getId(), projectId);

        illustrate(project, GenerationCancellation.none());
        return project;
    }

    public Project regenerateImages(String projectId) {
        Project project = getProject(projectId);
        illustrate(project, GenerationCancellation.none());
        return project;
    }

    public List<CharacterProfile> extractCharacters(String projectId) {
        Project project = getProject(projectId);
        Story story = project.getStory();
        List<CharacterProfile> characters = storyGenerator.extractCharacters(story.getPages());
        story.setCharacters(characters);
        story.touch();
        projectRepository.save(project);
        log.info("Stored {} characters for project {}", characters.size(), projectId);
        return characters;
    }

    public Project getProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    public List<Project> listProjects() {
        return projectRepository.findAll();
    }

    public void deleteProject(String projectId) {
        Project project = getProject(projectId);
        visualContext.releaseStory(project.getStory());
        projectRepository.deleteById(projectId);
        log.info("Deleted project {}", projectId);
    }

    private void illustrate(Project project, GenerationCancellation cancellation) {
        Story story = project.getStory();
        try {
            visualContext.generateImagesForStory(story, cancellation);
        } finally {
            long withImage = story.getPages().stream().filter(StoryPage::hasImage).count();
            if (!story.getPages().isEmpty() && withImage == story.getPages().size()) {
                project.setStatus(ProjectStatus.COMPLETED);
            } else if (withImage > 0) {
                project.setStatus(ProjectStatus.IMAGES_GENERATED);
            }
            if (cancellation.isCancelled()) {
                log.info("Illustration of project {} cancelled with {} of {} pages illustrated",
                        project.getId(), withImage, story.getPages().size());
            }
            // Persist completed pages and the latest session token, also when cancelled
            projectRepository.save(project);
        }
    }
}
