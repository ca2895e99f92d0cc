package com.contactintake.infrastructure.parsing.extraction;

import com.contactintake.domain.parse.model.RoomMatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a room/unit identifier in the text left after phone removal.
 *
 * Two tiers:
 *   1. Keyword: a label word ("Room 814", "Unit: A12", "#5") followed by a short token
 *   2. Fallback: first standalone short token shaped like [#][A-Z]digits[A-Z] that is not
 *      a phone fragment
 */
@Component
public class RoomExtractor {

    public static final int DEFAULT_MAX_DIGITS = 4;
    public static final int DEFAULT_PHONE_DIGIT_THRESHOLD = 7;

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    // Room label left behind once its token is gone ("Room -", "Flat:")
    private static final Pattern LABEL_RESIDUE = Pattern.compile(
            "(?<![A-Za-z])(?:room|rm|apt|apartment|flat|unit)(?![A-Za-z])\\s*[:#\\-]?\\s*",
            Pattern.CASE_INSENSITIVE
    );

    private final int phoneDigitThreshold;
    private final Pattern keywordPattern;
    private final Pattern candidatePattern;

    public RoomExtractor() {
        this(DEFAULT_MAX_DIGITS, DEFAULT_PHONE_DIGIT_THRESHOLD);
    }

    @Autowired
    public RoomExtractor(@Value("${contact-parser.room.max-digits:4}") int maxDigits,
                         @Value("${contact-parser.room.phone-digit-threshold:7}") int phoneDigitThreshold) {
        if (maxDigits < 1) {
            throw new IllegalArgumentException("Room max digits must be positive: " + maxDigits);
        }
        this.phoneDigitThreshold = phoneDigitThreshold;

        String token = "[A-Za-z]?\\d{1," + maxDigits + "}[A-Za-z]?";
        this.keywordPattern = Pattern.compile(
                "(?<![A-Za-z0-9])(?:(?:" + LabelWords.alternation(LabelWords.ROOM_LABELS) + ")(?![A-Za-z])|#)"
                        + "\\s*[:.#\\-]?\\s*#?(" + token + ")(?![A-Za-z0-9])",
                Pattern.CASE_INSENSITIVE
        );
        this.candidatePattern = Pattern.compile("(?<![A-Za-z0-9#])#?" + token + "(?![A-Za-z0-9])");
    }

    /**
     * Extract the room identifier.
     *
     * @param text         text remaining after phone removal
     * @param phoneMatches every raw phone match of the line; their fragments are never rooms
     * @return the room token and the span it consumed, or empty
     */
    public Optional<RoomMatch> extract(String text, List<String> phoneMatches) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher keyword = keywordPattern.matcher(text);
        if (keyword.find()) {
            return Optional.of(new RoomMatch(keyword.group(1), keyword.start(), keyword.end(), true));
        }

        List<String> phones = phoneMatches == null ? List.of() : phoneMatches;
        Matcher candidate = candidatePattern.matcher(text);
        while (candidate.find()) {
            String identifier = candidate.group().startsWith("#")
                    ? candidate.group().substring(1)
                    : candidate.group();
            if (looksLikePhoneFragment(identifier, phones)) {
                continue;
            }
            return Optional.of(new RoomMatch(identifier, candidate.start(), candidate.end(), false));
        }
        return Optional.empty();
    }

    /**
     * Remove room label words that no longer introduce a token.
     */
    public String stripLabelResidue(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return LABEL_RESIDUE.matcher(text).replaceAll(" ").strip();
    }

    private boolean looksLikePhoneFragment(String identifier, List<String> phones) {
        int digits = NON_DIGIT.matcher(identifier).replaceAll("").length();
        if (digits >= phoneDigitThreshold) {
            return true;
        }
        return phones.stream().anyMatch(phone -> phone.contains(identifier));
    }
}
