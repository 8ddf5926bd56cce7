package org.example.storybook.cli;

import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.Project;
import org.example.storybook.model.StoryMetadata;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.GenerationCancellation;
import org.example.storybook.service.ProjectOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Command-line runner that generates one illustrated story from the generate.* properties.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=generate
 * Or: java -jar target/storybook.jar --spring.profiles.active=generate --generate.title="..."
 */
@Component
@Profile("generate")
public class StoryGenerationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StoryGenerationRunner.class);

    private final ProjectOrchestrator projectOrchestrator;

    @Value("${generate.title:Untitled Story}")
    private String title;

    @Value("${generate.language:English}")
    private String language;

    @Value("${generate.complexity:simple}")
    private String complexity;

    @Value("${generate.vocabulary-diversity:moderate}")
    private String vocabularyDiversity;

    @Value("${generate.age-group:4-6}")
    private String ageGroup;

    @Value("${generate.num-pages:5}")
    private int numPages;

    @Value("${storybook.defaults.words-per-page:50}")
    private int wordsPerPage;

    @Value("${generate.genre:}")
    private String genre;

    @Value("${storybook.defaults.art-style:cartoon}")
    private String artStyle;

    @Value("${generate.theme:}")
    private String theme;

    @Value("${generate.prompt:}")
    private String prompt;

    @Value("${generate.visual-context:true}")
    private boolean establishVisualContext;

    public StoryGenerationRunner(ProjectOrchestrator projectOrchestrator) {
        this.projectOrchestrator = projectOrchestrator;
    }

    @Override
    public void run(String... args) {
        log.info("========================================");
        log.info("Story Generation Runner");
        log.info("========================================");
        log.info("'{}': {} pages, {} words/page, style={}", title, numPages, wordsPerPage, artStyle);

        StoryMetadata metadata = new StoryMetadata(title, language, complexity, vocabularyDiversity,
                ageGroup, numPages, wordsPerPage, blankToNull(genre), artStyle, blankToNull(prompt));

        Project project = projectOrchestrator.createProject(metadata, blankToNull(theme), null,
                establishVisualContext, GenerationCancellation.none());

        for (CharacterProfile character : project.getStory().getCharacters()) {
            log.info("  - Character: {} ({})", character.name(), character.species());
        }

        log.info("");
        log.info("========================================");
        log.info("GENERATION COMPLETE - {}", project.getStatus());
        log.info("========================================");
        log.info("Project: {}", project.getId());
        log.info("Story: {}", project.getStory().getId());
        for (StoryPage page : project.getStory().getPages()) {
            log.info("[Page {}] {}", page.getPageNumber(), page.getText());
            log.info("  image: {}", page.hasImage() ? abbreviate(page.getImageUrl()) : "(none)");
        }
        log.info("========================================");
    }

    private static String abbreviate(String imageUrl) {
        return imageUrl.length() > 80 ? imageUrl.substring(0, 80) + "..." : imageUrl;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
