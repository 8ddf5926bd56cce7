package org.example.storybook.service;

import org.example.storybook.model.CharacterProfile;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Condenses a page of story text into a short visual description for the illustrator.
 * Never fails: any provider problem falls back to a truncated copy of the page text.
 */
@Service
public class SceneSummarizer {

    private static final Logger log = LoggerFactory.getLogger(SceneSummarizer.class);
    static final int FALLBACK_LENGTH = 200;
    private static final double SUMMARY_TEMPERATURE = 0.3;
    private static final int SUMMARY_MAX_TOKENS = 150;

    private final LlmProvider analysisProvider;
    private final PromptComposer promptComposer;

    public SceneSummarizer(@Qualifier("analysisLlmProvider") LlmProvider analysisProvider,
                           PromptComposer promptComposer) {
        this.analysisProvider = analysisProvider;
        this.promptComposer = promptComposer;
    }

    public String summarize(String sceneText, List<CharacterProfile> characters) {
        if (sceneText == null || sceneText.isBlank()) {
            return "";
        }
        String prompt = promptComposer.buildSceneSummaryPrompt(sceneText, characters);
        LlmOptions options = LlmOptions.withTemperatureAndMaxTokens(SUMMARY_TEMPERATURE, SUMMARY_MAX_TOKENS)
                .withSystemMessage(PromptComposer.SCENE_SUMMARY_SYSTEM_MESSAGE);
        try {
            String summary = cleanSummary(analysisProvider.generate(prompt, options));
            if (summary.isEmpty()) {
                log.warn("Empty scene summary from {}, using page text", analysisProvider.getProviderName());
                return fallback(sceneText);
            }
            return summary;
        } catch (Exception e) {
            log.warn("Scene summary failed, using page text: {}", e.getMessage());
            return fallback(sceneText);
        }
    }

    private String fallback(String sceneText) {
        return PromptComposer.smartTruncate(sceneText.trim(), FALLBACK_LENGTH);
    }

    private String cleanSummary(String summary) {
        if (summary == null) {
            return "";
        }
        String cleaned = summary.trim();
        if (cleaned.length() > 1 && cleaned.startsWith("\"") && cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }
        if (cleaned.toLowerCase().startsWith("scene:")) {
            cleaned = cleaned.substring(6).trim();
        }
        return cleaned;
    }
}
