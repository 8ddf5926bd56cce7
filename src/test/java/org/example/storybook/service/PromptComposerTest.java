package org.example.storybook.service;

import org.example.storybook.config.StorybookProperties;
import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.StoryMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptComposerTest {

    private PromptComposer composer;

    private final CharacterProfile max = new CharacterProfile(
            "Max", "Dog", "small scruffy terrier with brown fur and floppy ears",
            "red scarf", "white patch over one eye", "curious and brave");
    private final CharacterProfile luna = new CharacterProfile(
            "Luna", "Cat", "slender grey cat with green eyes", null, null, null);
    private final CharacterProfile owl = new CharacterProfile(
            "Oscar", "Owl", "round brown owl with spectacles", null, null, null);

    @BeforeEach
    void setUp() {
        composer = new PromptComposer(new StorybookProperties());
    }

    @Test
    void composeImagePrompt_withoutContext_usesStyleCharactersSceneAndShortSuffix() {
        String prompt = composer.composeImagePrompt(
                "Max chases a butterfly in the meadow", List.of(max), "watercolor", null, List.of());

        assertTrue(prompt.startsWith("A watercolor style children's book illustration showing Max (a Dog, "));
        assertTrue(prompt.contains("white patch over one eye"));
        assertTrue(prompt.contains("in this scene: Max chases a butterfly in the meadow."));
        assertTrue(prompt.endsWith("Vibrant colors, child-friendly, professional children's book illustration style."));
        assertFalse(prompt.contains("must match the character reference"));
    }

    @Test
    void composeImagePrompt_includesAtMostTwoCharacters() {
        String prompt = composer.composeImagePrompt("A picnic", List.of(max, luna, owl), "cartoon", null, null);

        assertTrue(prompt.contains("Max (a Dog"));
        assertTrue(prompt.contains("Luna (a Cat"));
        assertFalse(prompt.contains("Oscar"));
    }

    @Test
    void composeImagePrompt_skipsProfilesWithoutSpeciesOrDescription() {
        CharacterProfile vague = new CharacterProfile("Ghost", null, "misty", null, null, null);

        String prompt = composer.composeImagePrompt("A picnic", List.of(vague, luna), "cartoon", null, null);

        assertFalse(prompt.contains("Ghost"));
        assertTrue(prompt.contains("Luna (a Cat"));
    }

    @Test
    void composeImagePrompt_unnamedProfileRendersAsSpecies() {
        CharacterProfile unnamed = new CharacterProfile(null, "frog", "tiny green frog", null, null, null);

        String prompt = composer.composeImagePrompt("By the pond", List.of(unnamed), "cartoon", null, null);

        assertTrue(prompt.contains("showing a frog (tiny green frog)"));
    }

    @Test
    void composeImagePrompt_withArtBibleAndReference_addsDescriptorsAndStrongMatchLanguage() {
        ArtBible artBible = composer.createArtBible("watercolor", "fable", "Max and the Meadow", "muted autumn tones");
        CharacterReference reference = new CharacterReference("MAX", "reference sheet");

        String prompt = composer.composeImagePrompt(
                "Max naps", List.of(max, luna), "watercolor", artBible, List.of(reference));

        assertTrue(prompt.contains("palette: soft pastel washes"));
        assertTrue(prompt.contains("notes: muted autumn tones"));
        assertTrue(prompt.contains("curious and brave; must match the character reference exactly)"));
        assertFalse(prompt.contains("Luna (a Cat, slender grey cat with green eyes; must match"));
        assertTrue(prompt.contains("Keep the established art bible and character references exactly"));
    }

    @Test
    void composeImagePrompt_truncatesLongSceneAtWordBoundary() {
        String scene = "word ".repeat(100).trim();

        String prompt = composer.composeImagePrompt(scene, List.of(), "cartoon", null, null);

        int start = prompt.indexOf("in this scene: ") + "in this scene: ".length();
        int end = prompt.indexOf(". Vibrant");
        String sceneInPrompt = prompt.substring(start, end);
        assertTrue(sceneInPrompt.length() <= PromptComposer.SCENE_LIMIT);
        assertTrue(sceneInPrompt.endsWith("word"));
    }

    @Test
    void composeImagePrompt_neverExceedsBudget() {
        StorybookProperties properties = new StorybookProperties();
        properties.getPrompt().setMaxLength(300);
        PromptComposer tight = new PromptComposer(properties);
        ArtBible artBible = tight.createArtBible("storybook", "adventure", "A Long Journey", "x".repeat(200));
        String scene = "The two friends climb the tallest hill to watch the sunrise over the sleepy village. ".repeat(4);

        String prompt = tight.composeImagePrompt(scene, List.of(max, luna), "storybook", artBible,
                List.of(new CharacterReference("Max", "sheet")));

        assertTrue(prompt.length() <= 300, "length was " + prompt.length());
        assertTrue(prompt.endsWith("..."));
    }

    @Test
    void composeImagePrompt_shrinksSceneBeforeCuttingTheRest() {
        StorybookProperties properties = new StorybookProperties();
        properties.getPrompt().setMaxLength(420);
        PromptComposer tight = new PromptComposer(properties);
        String scene = "Max and Luna share a picnic under the old oak tree while leaves fall around them. ".repeat(3);

        String prompt = tight.composeImagePrompt(scene, List.of(max), "cartoon", null, null);

        assertTrue(prompt.length() <= 420, "length was " + prompt.length());
        assertTrue(prompt.contains("in this scene: Max and Luna"));
        assertTrue(prompt.endsWith("professional children's book illustration style."));
    }

    @Test
    void composeConversationPrompt_containsStyleAndScene() {
        String prompt = composer.composeConversationPrompt("Luna climbs a tree", "anime");

        assertTrue(prompt.contains("same anime style"));
        assertTrue(prompt.contains("Scene: Luna climbs a tree."));
        assertTrue(prompt.length() <= composer.getMaxPromptLength());
    }

    @Test
    void smartTruncate_cutsAtLastSpace() {
        assertEquals("the quick", PromptComposer.smartTruncate("the quick brown fox", 12));
        assertEquals("abcdefgh", PromptComposer.smartTruncate("abcdefghijkl", 8));
        assertEquals("short", PromptComposer.smartTruncate("short", 10));
        assertNull(PromptComposer.smartTruncate(null, 10));
    }

    @Test
    void buildStoryPrompt_describesRequirementsAndForbidsPageMarkers() {
        StoryMetadata metadata = new StoryMetadata("The Brave Kite", "Spanish", "simple", "rich", "4-6",
                6, 40, "adventure", "cartoon", "a kite that wants to touch the moon");

        String prompt = composer.buildStoryPrompt(metadata, "courage", null);

        assertTrue(prompt.startsWith("Write a simple children's story in Spanish for children aged 4-6."));
        assertTrue(prompt.contains("exactly 6 pages, about 40 words per page"));
        assertTrue(prompt.contains("roughly 240 words"));
        assertTrue(prompt.contains("Genre: adventure."));
        assertTrue(prompt.contains("Theme: courage."));
        assertTrue(prompt.contains("Story idea: a kite that wants to touch the moon."));
        assertTrue(prompt.contains("Use rich vocabulary."));
        assertTrue(prompt.contains("Do not add page numbers"));
    }

    @Test
    void buildStoryPrompt_customPromptOverridesMetadataIdea() {
        StoryMetadata metadata = new StoryMetadata("T", "English", "simple", "basic", "3-5",
                3, null, null, null, "metadata idea");

        String prompt = composer.buildStoryPrompt(metadata, null, "custom idea");

        assertTrue(prompt.contains("Story idea: custom idea."));
        assertFalse(prompt.contains("metadata idea"));
        assertTrue(prompt.contains("about 50 words per page"));
    }

    @Test
    void buildSceneSummaryPrompt_listsUpToThreeNamedCharacters() {
        CharacterProfile fourth = new CharacterProfile("Bea", "Bee", "striped bee", null, null, null);

        String prompt = composer.buildSceneSummaryPrompt("They all dance.", List.of(max, luna, owl, fourth));

        assertTrue(prompt.startsWith("Characters: Max (a Dog), Luna (a Cat), Oscar (a Owl)"));
        assertFalse(prompt.contains("Bea"));
        assertTrue(prompt.contains("They all dance."));
    }

    @Test
    void createArtBible_unknownStyleUsesGenericDescriptors() {
        ArtBible artBible = composer.createArtBible("mosaic", null, null, null);

        assertEquals("mosaic", artBible.getArtStyle());
        assertEquals("harmonious, age-appropriate colors", artBible.getColorPalette());
        assertTrue(artBible.getPrompt().startsWith("Art bible reference sheet for a mosaic style children's book."));
        assertNull(artBible.getImageUrl());
    }

    @Test
    void createCharacterReference_copiesProfileAndDescribesPose() {
        CharacterReference turnaround = composer.createCharacterReference(max, "cartoon", true);
        CharacterReference single = composer.createCharacterReference(max, "cartoon", false);

        assertEquals("Max", turnaround.getCharacterName());
        assertEquals("Dog", turnaround.getSpecies());
        assertEquals("red scarf", turnaround.getClothing());
        assertTrue(turnaround.getPrompt().contains("front, side and back"));
        assertTrue(single.getPrompt().contains("single full-body neutral pose"));
    }
}
