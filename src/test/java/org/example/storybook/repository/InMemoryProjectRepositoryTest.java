package org.example.storybook.repository;

import org.example.storybook.model.Project;
import org.example.storybook.model.Story;
import org.example.storybook.model.StoryMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProjectRepositoryTest {

    private final InMemoryProjectRepository repository = new InMemoryProjectRepository();

    @Test
    void saveFindAndDelete() {
        Project project = project("p-1");
        repository.save(project);

        assertSame(project, repository.findById("p-1").orElseThrow());
        assertTrue(repository.deleteById("p-1"));
        assertFalse(repository.deleteById("p-1"));
        assertTrue(repository.findById("p-1").isEmpty());
    }

    @Test
    void findAll_newestFirst() throws InterruptedException {
        repository.save(project("older"));
        Thread.sleep(5);
        repository.save(project("newer"));

        List<Project> all = repository.findAll();

        assertEquals(List.of("newer", "older"), all.stream().map(Project::getId).toList());
    }

    private static Project project(String id) {
        StoryMetadata metadata = new StoryMetadata("Title", "English", "simple", "low", "4-6",
                1, null, "adventure", null, null);
        return new Project(id, "Title", new Story("story-" + id, metadata, List.of()));
    }
}
