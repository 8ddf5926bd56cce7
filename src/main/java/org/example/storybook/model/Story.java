package org.example.storybook.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A generated story. Owned by the orchestration call that produced it and mutated in place
 * as pages, references and images are filled in.
 */
public class Story {

    private final String id;
    private StoryMetadata metadata;
    private List<StoryPage> pages = new ArrayList<>();
    private ArtBible artBible;
    private List<CharacterReference> characterReferences = new ArrayList<>();
    private List<CharacterProfile> characters = new ArrayList<>();
    private String imageSessionId;
    private final LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Story(String id, StoryMetadata metadata, List<StoryPage> pages) {
        this.id = id;
        this.metadata = metadata;
        this.pages = new ArrayList<>(pages);
        this.createdAt = LocalDateTime.now();
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public StoryMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(StoryMetadata metadata) {
        this.metadata = metadata;
    }

    public List<StoryPage> getPages() {
        return pages;
    }

    public void setPages(List<StoryPage> pages) {
        this.pages = new ArrayList<>(pages);
    }

    public Optional<StoryPage> findPage(int pageNumber) {
        return pages.stream()
                .filter(page -> page.getPageNumber() == pageNumber)
                .findFirst();
    }

    public ArtBible getArtBible() {
        return artBible;
    }

    public void setArtBible(ArtBible artBible) {
        this.artBible = artBible;
    }

    public List<CharacterReference> getCharacterReferences() {
        return characterReferences;
    }

    public void setCharacterReferences(List<CharacterReference> characterReferences) {
        this.characterReferences = new ArrayList<>(characterReferences);
    }

    public List<CharacterProfile> getCharacters() {
        return characters;
    }

    public void setCharacters(List<CharacterProfile> characters) {
        this.characters = new ArrayList<>(characters);
    }

    public String getImageSessionId() {
        return imageSessionId;
    }

    public void setImageSessionId(String imageSessionId) {
        this.imageSessionId = imageSessionId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    public String getArtStyle() {
        if (metadata != null) {
            return metadata.effectiveArtStyle();
        }
        return StoryMetadata.DEFAULT_ART_STYLE;
    }
}
