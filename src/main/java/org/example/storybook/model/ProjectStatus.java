package org.example.storybook.model;

public enum ProjectStatus {
    DRAFT,
    STORY_GENERATED,
    IMAGES_GENERATED,
    COMPLETED
}
