package org.example.storybook.model;

import java.time.LocalDateTime;

public class Project {

    private final String id;
    private String name;
    private Story story;
    private ProjectStatus status = ProjectStatus.DRAFT;
    private final LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Project(String id, String name, Story story) {
        this.id = id;
        this.name = name;
        this.story = story;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Story getStory() {
        return story;
    }

    public void setStory(Story story) {
        this.story = story;
    }

    public ProjectStatus getStatus() {
        return status;
    }

    public void setStatus(ProjectStatus status) {
        this.status = status;
        this.updatedAt = LocalDateTime.now();
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
