package org.example.storybook.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A character as first identified in the story text, before profiling.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedCharacter(
    @JsonAlias({"character_name", "character"})
    String name,
    @JsonAlias({"physical_description", "brief_description", "desc"})
    String description
) {}
