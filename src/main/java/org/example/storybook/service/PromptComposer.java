package org.example.storybook.service;

import org.example.storybook.config.StorybookProperties;
import org.example.storybook.model.ArtBible;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.CharacterReference;
import org.example.storybook.model.StoryMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds every prompt the pipeline sends: story text, scene summaries, art bible,
 * character reference sheets and page illustrations. Image prompts are bounded by
 * {@code storybook.prompt.max-length}. No network access.
 */
@Component
public class PromptComposer {

    static final int SCENE_LIMIT = 200;
    static final int CONVERSATION_SCENE_LIMIT = 300;
    static final int DESCRIPTOR_LIMIT = 80;
    static final int NOTES_LIMIT = 120;
    static final int PHYSICAL_LIMIT = 100;
    static final int TRAIT_LIMIT = 60;
    static final int MAX_PROMPT_CHARACTERS = 2;
    static final int MAX_SUMMARY_CHARACTERS = 3;
    private static final int MIN_SCENE_BUDGET = 20;
    private static final String ELLIPSIS = "...";
    private static final String SCENE_LEAD = " in this scene: ";

    public static final String SCENE_SUMMARY_SYSTEM_MESSAGE =
            "You describe the single most important visual moment of a children's story page "
            + "for an illustrator. Answer in 30 to 50 words with one concrete description of "
            + "who is there, what they are doing and where. No preamble, no quotes.";

    private static final String SHORT_SUFFIX =
            "Vibrant colors, child-friendly, professional children's book illustration style.";
    private static final String CONSISTENCY_SUFFIX =
            "Keep the established art bible and character references exactly: same palette, "
            + "lighting, proportions, colors and outfits. Vibrant, child-friendly, "
            + "professional children's book illustration style.";

    private record StyleDescriptors(String colorPalette, String lightingStyle, String brushTechnique) {}

    private static final StyleDescriptors GENERIC_STYLE = new StyleDescriptors(
            "harmonious, age-appropriate colors",
            "soft, even lighting",
            "clean, consistent rendering");

    private static final Map<String, StyleDescriptors> STYLE_DESCRIPTORS = Map.of(
            "cartoon", new StyleDescriptors(
                    "bright saturated primary colors", "flat cheerful daylight", "bold outlines with flat cel shading"),
            "watercolor", new StyleDescriptors(
                    "soft pastel washes with gentle gradients", "diffuse natural light", "wet-on-wet watercolor with visible paper texture"),
            "realistic", new StyleDescriptors(
                    "natural true-to-life colors", "realistic directional lighting with soft shadows", "detailed painterly rendering"),
            "storybook", new StyleDescriptors(
                    "warm earthy tones with rich accents", "warm golden-hour glow", "classic gouache with fine ink linework"),
            "anime", new StyleDescriptors(
                    "vivid colors with clean gradients", "crisp rim lighting", "clean line art with cel shading"),
            "pencil sketch", new StyleDescriptors(
                    "graphite grays with light color accents", "soft studio lighting", "hand-drawn pencil hatching"),
            "digital art", new StyleDescriptors(
                    "vibrant digital palette", "dynamic lighting with soft glow", "smooth digital painting"),
            "pastel", new StyleDescriptors(
                    "light pastel pinks, blues and yellows", "airy dreamy light", "soft chalk pastel strokes"),
            "claymation", new StyleDescriptors(
                    "bold matte clay colors", "miniature set lighting", "sculpted plasticine look with fingerprint texture")
    );

    private final int maxPromptLength;

    public PromptComposer(StorybookProperties properties) {
        this.maxPromptLength = properties.getPrompt().getMaxLength();
    }

    public int getMaxPromptLength() {
        return maxPromptLength;
    }

    // Story text

    public String buildStoryPrompt(StoryMetadata metadata, String theme, String customPrompt) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format(
                "Write a %s children's story in %s for children aged %s. ",
                metadata.complexity(), metadata.language(), metadata.ageGroup()));
        prompt.append(String.format(
                "The story will be printed across exactly %d pages, about %d words per page, "
                + "so aim for roughly %d words in total. ",
                metadata.numPages(), metadata.effectiveWordsPerPage(),
                metadata.numPages() * metadata.effectiveWordsPerPage()));
        if (hasText(metadata.title())) {
            prompt.append("Title: ").append(metadata.title()).append(". ");
        }
        if (hasText(metadata.genre())) {
            prompt.append("Genre: ").append(metadata.genre()).append(". ");
        }
        if (hasText(theme)) {
            prompt.append("Theme: ").append(theme).append(". ");
        }
        String idea = hasText(customPrompt) ? customPrompt : metadata.userPrompt();
        if (hasText(idea)) {
            prompt.append("Story idea: ").append(idea).append(". ");
        }
        prompt.append(String.format("Use %s vocabulary. ", metadata.vocabularyDiversity()));
        prompt.append("Write continuous prose only. Do not add page numbers, page headings, "
                + "a title line or any commentary before or after the story.");
        return prompt.toString();
    }

    // Scene summaries

    public String buildSceneSummaryPrompt(String sceneText, List<CharacterProfile> characters) {
        StringBuilder prompt = new StringBuilder();
        List<CharacterProfile> named = characters == null ? List.of() : characters.stream()
                .filter(CharacterProfile::hasName)
                .limit(MAX_SUMMARY_CHARACTERS)
                .toList();
        if (!named.isEmpty()) {
            prompt.append("Characters: ");
            List<String> entries = new ArrayList<>();
            for (CharacterProfile profile : named) {
                entries.add(hasText(profile.species())
                        ? profile.name() + " (a " + profile.species() + ")"
                        : profile.name());
            }
            prompt.append(String.join(", ", entries)).append("\n\n");
        }
        prompt.append("Page text:\n").append(sceneText).append("\n\n");
        prompt.append("Describe the key visual moment of this page in 30-50 words.");
        return prompt.toString();
    }

    // Visual context

    public ArtBible createArtBible(String artStyle, String genre, String storyTitle, String additionalNotes) {
        String style = hasText(artStyle) ? artStyle : StoryMetadata.DEFAULT_ART_STYLE;
        StyleDescriptors descriptors = STYLE_DESCRIPTORS.getOrDefault(style.toLowerCase(Locale.ROOT), GENERIC_STYLE);

        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format(
                "Art bible reference sheet for a %s style children's book", style));
        if (hasText(storyTitle)) {
            prompt.append(" titled \"").append(storyTitle).append("\"");
        }
        if (hasText(genre)) {
            prompt.append(" (").append(genre).append(")");
        }
        prompt.append(". Show a representative scene plus color swatches that define the book's look. ");
        prompt.append("Color palette: ").append(descriptors.colorPalette()).append(". ");
        prompt.append("Lighting: ").append(descriptors.lightingStyle()).append(". ");
        prompt.append("Technique: ").append(descriptors.brushTechnique()).append(". ");
        if (hasText(additionalNotes)) {
            prompt.append("Notes: ").append(additionalNotes).append(". ");
        }
        prompt.append("No text or lettering in the image.");

        return new ArtBible(prompt.toString(), style,
                descriptors.colorPalette(), descriptors.lightingStyle(), descriptors.brushTechnique(),
                additionalNotes);
    }

    public CharacterReference createCharacterReference(CharacterProfile profile, String artStyle,
                                                       boolean includeTurnaround) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format("Character reference sheet in %s style for %s",
                artStyle, profile.name()));
        if (hasText(profile.species())) {
            prompt.append(", a ").append(profile.species());
        }
        prompt.append(". ");
        if (hasText(profile.physicalDescription())) {
            prompt.append("Appearance: ").append(profile.physicalDescription()).append(". ");
        }
        if (hasText(profile.clothing())) {
            prompt.append("Clothing: ").append(profile.clothing()).append(". ");
        }
        if (hasText(profile.distinctiveFeatures())) {
            prompt.append("Distinctive features: ").append(profile.distinctiveFeatures()).append(". ");
        }
        if (hasText(profile.personalityTraits())) {
            prompt.append("Expression reflects: ").append(profile.personalityTraits()).append(". ");
        }
        if (includeTurnaround) {
            prompt.append("Show the character from the front, side and back in a neutral pose, side by side, ");
        } else {
            prompt.append("Show the character in a single full-body neutral pose, ");
        }
        prompt.append("on a plain white background with no text.");
        return CharacterReference.fromProfile(profile, prompt.toString());
    }

    // Page illustrations

    public String composeImagePrompt(String sceneSummary, List<CharacterProfile> characters, String artStyle,
                                     ArtBible artBible, List<CharacterReference> references) {
        List<CharacterReference> refs = references == null ? List.of() : references;
        boolean hasContext = artBible != null || !refs.isEmpty();

        String style = buildStyleSection(artStyle, artBible);
        String cast = buildCharacterSection(characters, refs);
        String suffix = hasContext ? CONSISTENCY_SUFFIX : SHORT_SUFFIX;
        String scene = sceneSummary == null ? "" : sceneSummary.trim();

        String prompt = assemble(style, cast, smartTruncate(scene, SCENE_LIMIT), suffix);
        if (prompt.length() <= maxPromptLength) {
            return prompt;
        }

        // Shrink the scene first, then drop it
        int sceneBudget = maxPromptLength - assemble(style, cast, "", suffix).length() - SCENE_LEAD.length();
        prompt = sceneBudget >= MIN_SCENE_BUDGET
                ? assemble(style, cast, smartTruncate(scene, sceneBudget), suffix)
                : assemble(style, cast, "", suffix);
        if (prompt.length() <= maxPromptLength) {
            return prompt;
        }
        return smartTruncate(prompt, maxPromptLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Prompt for a page turn inside an established conversation. The art bible and
     * references already live in the conversation, so only the scene is sent.
     */
    public String composeConversationPrompt(String sceneSummary, String artStyle) {
        String scene = smartTruncate(sceneSummary == null ? "" : sceneSummary.trim(), CONVERSATION_SCENE_LIMIT);
        String prompt = String.format(
                "Illustrate the next page in the same %s style. Scene: %s "
                + "Keep every character exactly as in the character references and the art bible.",
                artStyle, ensureSentence(scene));
        if (prompt.length() <= maxPromptLength) {
            return prompt;
        }
        return smartTruncate(prompt, maxPromptLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Truncate at the last space before {@code maxLength}. Text without spaces is cut hard.
     */
    public static String smartTruncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 0) {
            return "";
        }
        String truncated = text.substring(0, maxLength);
        int lastSpace = truncated.lastIndexOf(' ');
        return lastSpace > 0 ? truncated.substring(0, lastSpace) : truncated;
    }

    private String buildStyleSection(String artStyle, ArtBible artBible) {
        StringBuilder style = new StringBuilder(String.format(
                "A %s style children's book illustration", artStyle));
        if (artBible != null) {
            List<String> descriptors = new ArrayList<>();
            addDescriptor(descriptors, "palette", artBible.getColorPalette(), DESCRIPTOR_LIMIT);
            addDescriptor(descriptors, "lighting", artBible.getLightingStyle(), DESCRIPTOR_LIMIT);
            addDescriptor(descriptors, "technique", artBible.getBrushTechnique(), DESCRIPTOR_LIMIT);
            addDescriptor(descriptors, "notes", artBible.getStyleNotes(), NOTES_LIMIT);
            if (!descriptors.isEmpty()) {
                style.append(" (").append(String.join("; ", descriptors)).append(")");
            }
        }
        return style.toString();
    }

    private String buildCharacterSection(List<CharacterProfile> characters, List<CharacterReference> references) {
        if (characters == null || characters.isEmpty()) {
            return "";
        }
        List<String> blocks = new ArrayList<>();
        for (CharacterProfile profile : characters) {
            if (blocks.size() == MAX_PROMPT_CHARACTERS) {
                break;
            }
            if (!hasText(profile.species()) || !hasText(profile.physicalDescription())) {
                continue;
            }
            List<String> details = new ArrayList<>();
            details.add(smartTruncate(profile.physicalDescription(), PHYSICAL_LIMIT));
            addIfPresent(details, profile.distinctiveFeatures());
            addIfPresent(details, profile.clothing());
            addIfPresent(details, profile.personalityTraits());

            String block;
            if (profile.hasName()) {
                block = profile.name() + " (a " + profile.species() + ", " + String.join(", ", details);
                if (hasReference(profile.name(), references)) {
                    block += "; must match the character reference exactly";
                }
                block += ")";
            } else {
                block = "a " + profile.species() + " (" + String.join(", ", details) + ")";
            }
            blocks.add(block);
        }
        return String.join(" and ", blocks);
    }

    private String assemble(String style, String cast, String scene, String suffix) {
        StringBuilder prompt = new StringBuilder(style);
        if (!cast.isEmpty()) {
            prompt.append(" showing ").append(cast);
        }
        if (scene != null && !scene.isEmpty()) {
            prompt.append(SCENE_LEAD).append(scene);
        }
        return ensureSentence(prompt.toString()) + " " + suffix;
    }

    private void addDescriptor(List<String> descriptors, String label, String value, int limit) {
        if (hasText(value)) {
            descriptors.add(label + ": " + smartTruncate(value.trim(), limit));
        }
    }

    private void addIfPresent(List<String> details, String value) {
        if (hasText(value)) {
            details.add(smartTruncate(value.trim(), TRAIT_LIMIT));
        }
    }

    private boolean hasReference(String name, List<CharacterReference> references) {
        for (CharacterReference reference : references) {
            if (reference.getCharacterName() != null && reference.getCharacterName().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static String ensureSentence(String text) {
        if (text.isEmpty() || text.endsWith(".") || text.endsWith("!") || text.endsWith("?")) {
            return text;
        }
        return text + ".";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
