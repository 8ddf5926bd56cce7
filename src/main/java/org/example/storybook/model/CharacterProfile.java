package org.example.storybook.model;

/**
 * Detailed visual profile of a story character, used to keep illustrations consistent.
 */
public record CharacterProfile(
    String name,
    String species,
    String physicalDescription,
    String clothing,            // nullable
    String distinctiveFeatures, // nullable
    String personalityTraits    // nullable
) {
    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
