package org.example.storybook.service;

import org.example.storybook.model.StoryPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits story text into pages at sentence boundaries, balancing words per page.
 * A sentence is never split across pages.
 */
@Component
public class SentencePaginator {

    private static final Logger log = LoggerFactory.getLogger(SentencePaginator.class);

    private static final Pattern PAGE_MARKER = Pattern.compile("(?iu)\\b(?:page|página)\\s+\\d+\\s*:");
    private static final Pattern SENTENCE = Pattern.compile("[^.!?]*[.!?]+[\"'”’)\\]]*");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // A page may grow to this multiple of the ideal size before a sentence is pushed to the next page
    private static final double OVERFLOW_FACTOR = 1.5;

    public List<StoryPage> paginate(String text, int targetPageCount, int targetWordsPerPage) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }

        int slots = Math.max(1, targetPageCount);
        List<String> sentences = splitIntoSentences(normalized);
        int[] wordCounts = sentences.stream().mapToInt(SentencePaginator::countWords).toArray();
        int remainingWords = Arrays.stream(wordCounts).sum();
        int totalWords = remainingWords;

        List<String> pageTexts = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentWords = 0;
        int ideal = Math.max(1, remainingWords / slots);

        for (int i = 0; i < sentences.size(); i++) {
            int words = wordCounts[i];

            boolean lastSlot = pageTexts.size() >= slots - 1;
            if (!current.isEmpty() && !lastSlot && currentWords + words > OVERFLOW_FACTOR * ideal) {
                pageTexts.add(String.join(" ", current));
                remainingWords -= currentWords;
                current.clear();
                currentWords = 0;
                ideal = Math.max(1, remainingWords / (slots - pageTexts.size()));
            }

            current.add(sentences.get(i));
            currentWords += words;

            int sentencesLeft = sentences.size() - i - 1;
            lastSlot = pageTexts.size() >= slots - 1;
            if (!lastSlot && sentencesLeft > 0) {
                int slotsAfter = slots - pageTexts.size() - 1;
                if (currentWords >= ideal || sentencesLeft <= slotsAfter) {
                    pageTexts.add(String.join(" ", current));
                    remainingWords -= currentWords;
                    current.clear();
                    currentWords = 0;
                    ideal = Math.max(1, remainingWords / (slots - pageTexts.size()));
                }
            }
        }
        if (!current.isEmpty()) {
            pageTexts.add(String.join(" ", current));
        }

        List<StoryPage> pages = new ArrayList<>(pageTexts.size());
        for (int i = 0; i < pageTexts.size(); i++) {
            pages.add(new StoryPage(i + 1, pageTexts.get(i)));
        }

        log.debug("Paginated {} words into {}/{} pages (avg {} words/page, target {})",
                totalWords, pages.size(), slots, totalWords / pages.size(), targetWordsPerPage);
        return pages;
    }

    String normalize(String text) {
        return PAGE_MARKER.matcher(text).replaceAll("").trim();
    }

    /**
     * Split into sentence units. Closing quotes and brackets stay with their sentence and a
     * trailing fragment without terminal punctuation becomes its own unit. Text without any
     * sentence punctuation falls back to paragraphs, then lines, then the whole text.
     */
    List<String> splitIntoSentences(String text) {
        List<String> units = new ArrayList<>();
        Matcher matcher = SENTENCE.matcher(text);
        int end = 0;
        while (matcher.find()) {
            units.add(matcher.group());
            end = matcher.end();
        }

        if (!units.isEmpty()) {
            if (end < text.length()) {
                units.add(text.substring(end));
            }
        } else {
            String[] paragraphs = PARAGRAPH_BREAK.split(text);
            if (paragraphs.length > 1) {
                units.addAll(Arrays.asList(paragraphs));
            } else {
                String[] lines = text.split("\\R");
                if (lines.length > 1) {
                    units.addAll(Arrays.asList(lines));
                } else {
                    units.add(text);
                }
            }
        }

        return units.stream()
                .map(unit -> WHITESPACE.matcher(unit.trim()).replaceAll(" "))
                .filter(unit -> !unit.isEmpty())
                .toList();
    }

    static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
