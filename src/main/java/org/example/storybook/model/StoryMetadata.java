package org.example.storybook.model;

/**
 * Parameters describing the story to generate.
 */
public record StoryMetadata(
    String title,
    String language,
    String complexity,
    String vocabularyDiversity,
    String ageGroup,
    int numPages,
    Integer wordsPerPage,   // nullable, defaults to 50
    String genre,           // nullable
    String artStyle,        // nullable, defaults to cartoon
    String userPrompt       // nullable
) {
    public static final int DEFAULT_WORDS_PER_PAGE = 50;
    public static final String DEFAULT_ART_STYLE = "cartoon";

    public StoryMetadata {
        if (numPages < 1) {
            throw new IllegalArgumentException("numPages must be at least 1, got " + numPages);
        }
    }

    public int effectiveWordsPerPage() {
        return wordsPerPage != null && wordsPerPage > 0 ? wordsPerPage : DEFAULT_WORDS_PER_PAGE;
    }

    public String effectiveArtStyle() {
        return artStyle != null && !artStyle.isBlank() ? artStyle : DEFAULT_ART_STYLE;
    }
}
