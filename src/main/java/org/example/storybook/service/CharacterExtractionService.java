package org.example.storybook.service;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.model.CharacterProfile;
import org.example.storybook.model.ExtractedCharacter;
import org.example.storybook.model.StoryPage;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
public class CharacterExtractionService {

    private static final Logger log = LoggerFactory.getLogger(CharacterExtractionService.class);

    private static final double EXTRACTION_TEMPERATURE = 0.3;
    private static final String DEFAULT_SPECIES = "human";

    private static final Set<String> GENERIC_SPECIES = Set.of(
            "character", "creature", "being", "figure", "protagonist", "main character");

    private static final Pattern HUMAN_WORDS = Pattern.compile(
            "\\b(human|boy|girl|man|woman|child|baby|kid|person|teenager|grandmother|grandfather|"
            + "mother|father|sister|brother|king|queen|prince|princess|knight|niño|niña|hombre|mujer|persona)\\b");

    // Checked in order; the first match wins
    private static final List<Pattern> SPECIES_PATTERNS = List.of(
            Pattern.compile("\\b(cat|dog|bird|fox|rabbit|bunny|mouse|elephant|lion|tiger|bear|wolf|deer|horse|"
                    + "cow|pig|sheep|goat|chicken|duck|squirrel|raccoon|hedgehog|hamster|gato|perro|zorro|conejo|oso)\\b"),
            Pattern.compile("\\b(dragon|unicorn|fairy|mermaid|giant|troll|elf|wizard|witch|goblin|ogre|phoenix|"
                    + "griffin|robot|dragón|hada|sirena|bruja|mago)\\b"),
            Pattern.compile("\\b(butterfly|bee|ant|spider|snake|frog|turtle|snail|caterpillar|ladybug|firefly|"
                    + "owl|eagle|penguin|parrot|crow|swan|flamingo|mariposa|rana|tortuga|búho)\\b"),
            Pattern.compile("\\b(dolphin|whale|shark|octopus|crab|seahorse|seal|otter|fish|monkey|gorilla|"
                    + "delfín|ballena|pulpo|pez|mono)\\b")
    );

    private final LlmProvider analysisProvider;
    private final ObjectMapper objectMapper;

    @Value("${character.extraction.max-characters:6}")
    private int maxCharacters;

    @Value("${character.extraction.max-story-chars:6000}")
    private int maxStoryChars;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractionResult(List<ExtractedCharacter> characters) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProfileResult(
            String species,
            @JsonAlias({"physical_description", "description"}) String physicalDescription,
            String clothing,
            @JsonAlias("distinctive_features") String distinctiveFeatures,
            @JsonAlias({"personality_traits", "personality"}) String personalityTraits) {}

    public CharacterExtractionService(@Qualifier("analysisLlmProvider") LlmProvider analysisProvider,
                                      ObjectMapper objectMapper) {
        this.analysisProvider = analysisProvider;
        this.objectMapper = objectMapper;
    }

    /**
     * Identify the main characters of a story.
     *
     * @throws CharacterExtractionException if the model output is not the expected JSON
     */
    public List<ExtractedCharacter> extractCharacters(List<StoryPage> pages) {
        String storyText = pages.stream()
                .map(StoryPage::getText)
                .collect(Collectors.joining("\n\n"));

        String prompt = String.format("""
            Read this children's story and list its main characters.

            Story:
            ---
            %s
            ---

            Rules:
            - Include at most %d characters, most important first
            - Only characters that appear on the page, not ones mentioned in passing
            - The description should focus on how the character looks

            Respond with ONLY valid JSON, no other text:
            {"characters": [{"name": "Character Name", "description": "short visual description"}]}

            If there are no characters, respond with: {"characters": []}
            """, PromptComposer.smartTruncate(storyText, maxStoryChars), maxCharacters);

        String response = analysisProvider.generate(prompt, LlmOptions.withTemperature(EXTRACTION_TEMPERATURE));
        ExtractionResult result = parse(response, ExtractionResult.class);
        if (result.characters() == null) {
            throw new CharacterExtractionException("Model response has no 'characters' field");
        }

        List<ExtractedCharacter> characters = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ExtractedCharacter character : result.characters()) {
            if (character == null || character.name() == null || character.name().isBlank()) {
                continue;
            }
            String key = character.name().trim().toLowerCase(Locale.ROOT);
            if (seen.add(key)) {
                characters.add(new ExtractedCharacter(character.name().trim(),
                        character.description() != null ? character.description().trim() : ""));
            }
            if (characters.size() >= maxCharacters) {
                break;
            }
        }
        log.info("Extracted {} characters", characters.size());
        return characters;
    }

    /**
     * Build a detailed visual profile for one character.
     *
     * @throws CharacterExtractionException if the model output is not the expected JSON
     */
    public CharacterProfile createCharacterProfile(ExtractedCharacter character, String storyContext) {
        String prompt = String.format("""
            Create a visual profile of a character from a children's story, for an illustrator
            who must draw the character identically on every page.

            Character: %s
            Known description: %s

            Story excerpt:
            ---
            %s
            ---

            Respond with ONLY valid JSON, no other text:
            {
              "species": "specific species such as human, dog, cat, rabbit, dragon",
              "physical_description": "size, body shape, colors of fur/skin/hair, eyes",
              "clothing": "what the character wears, or empty",
              "distinctive_features": "features that make the character recognizable",
              "personality_traits": "traits that show in expression or posture"
            }

            The species must be a concrete species, never "character", "creature" or "protagonist".
            """, character.name(), character.description(),
                PromptComposer.smartTruncate(storyContext, maxStoryChars));

        String response = analysisProvider.generate(prompt, LlmOptions.withTemperature(EXTRACTION_TEMPERATURE));
        ProfileResult result = parse(response, ProfileResult.class);

        String physical = firstNonBlank(result.physicalDescription(), character.description());
        String species = resolveSpecies(result.species(), character.name(), physical);
        return new CharacterProfile(
                character.name(),
                species,
                physical,
                blankToNull(result.clothing()),
                blankToNull(result.distinctiveFeatures()),
                blankToNull(result.personalityTraits()));
    }

    /**
     * Extract characters and profile each one. A character whose profile fails is skipped.
     */
    public List<CharacterProfile> extractCharacterProfiles(List<StoryPage> pages) {
        List<ExtractedCharacter> characters = extractCharacters(pages);
        String storyContext = pages.stream().map(StoryPage::getText).collect(Collectors.joining("\n\n"));

        List<CharacterProfile> profiles = new ArrayList<>();
        for (ExtractedCharacter character : characters) {
            try {
                CharacterProfile profile = createCharacterProfile(character, storyContext);
                profiles.add(profile);
                log.debug("Profiled character {} ({})", profile.name(), profile.species());
            } catch (Exception e) {
                log.warn("Failed to profile character '{}': {}", character.name(), e.getMessage());
            }
        }
        return profiles;
    }

    /**
     * Replace missing or generic species with one inferred from the description, then the
     * name. Defaults to human. Returned capitalized.
     */
    static String resolveSpecies(String rawSpecies, String name, String description) {
        String species = rawSpecies == null ? "" : rawSpecies.trim().toLowerCase(Locale.ROOT);
        if (species.isEmpty() || GENERIC_SPECIES.contains(species)) {
            String inferred = inferSpecies(description);
            if (inferred == null) {
                inferred = inferSpecies(name);
            }
            species = inferred != null ? inferred : DEFAULT_SPECIES;
        }
        return Character.toUpperCase(species.charAt(0)) + species.substring(1);
    }

    private static String inferSpecies(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (HUMAN_WORDS.matcher(lower).find()) {
            return DEFAULT_SPECIES;
        }
        for (Pattern pattern : SPECIES_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private <T> T parse(String response, Class<T> type) {
        String json = extractJsonObject(response);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new CharacterExtractionException("Model returned null JSON");
            }
            return value;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable model output: {}", response);
            throw new CharacterExtractionException("Model returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String extractJsonObject(String response) {
        if (response == null) {
            throw new CharacterExtractionException("Model returned no output");
        }
        String cleaned = response.replace("```json", "").replace("```", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new CharacterExtractionException("No JSON object in model output");
        }
        return cleaned.substring(start, end + 1);
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first.trim() : second;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
