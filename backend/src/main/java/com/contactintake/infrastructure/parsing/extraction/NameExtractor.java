package com.contactintake.infrastructure.parsing.extraction;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks a display name from the text left after phone and room removal.
 *
 * The first separator-delimited segment is tried first ("First Last" or a single "First");
 * if that fails, the whole text is scanned for two adjacent name-like tokens.
 * A token is name-like when it is capitalized and made of letters, apostrophes and hyphens.
 */
@Component
public class NameExtractor {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 2;

    // Hyphens between two letters belong to the name ("Mary-Jane")
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile(
            "[|,;:]|(?<![A-Za-z])-|-(?![A-Za-z])"
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern NAME_TOKEN = Pattern.compile("[A-Z][A-Za-z'\\-]*");

    private final int minTokenLength;

    public NameExtractor() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    @Autowired
    public NameExtractor(@Value("${contact-parser.name.min-token-length:2}") int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    /**
     * Extract a name.
     *
     * @param text text remaining after phone and room removal
     * @return "First Last", "First", or empty
     */
    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String primary = Arrays.stream(SEGMENT_SEPARATOR.split(text))
                .map(String::strip)
                .filter(segment -> !segment.isEmpty())
                .findFirst()
                .orElse(text.strip());

        List<String> words = candidateTokens(primary);
        if (words.size() >= 2 && looksLikeName(words.get(0)) && looksLikeName(words.get(1))) {
            return Optional.of(words.get(0) + " " + words.get(1));
        }
        if (!words.isEmpty() && looksLikeName(words.get(0))) {
            return Optional.of(words.get(0));
        }

        List<String> all = candidateTokens(text);
        for (int i = 0; i < all.size() - 1; i++) {
            if (looksLikeName(all.get(i)) && looksLikeName(all.get(i + 1))) {
                return Optional.of(all.get(i) + " " + all.get(i + 1));
            }
        }
        return Optional.empty();
    }

    /**
     * Capitalization heuristic for a single token.
     */
    public boolean looksLikeName(String word) {
        return word != null
                && word.length() >= minTokenLength
                && NAME_TOKEN.matcher(word).matches();
    }

    private static List<String> candidateTokens(String text) {
        return Arrays.stream(WHITESPACE.split(text.strip()))
                .filter(word -> !word.isEmpty())
                .filter(word -> !LabelWords.isLabel(word))
                .filter(word -> !DIGIT.matcher(word).find())
                .toList();
    }
}
