package com.contactintake.infrastructure.parsing.preprocessing;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes one candidate line before field extraction:
 * - Leading list markers ("1. ", "- ", "(1) ", "[1] ") stripped
 * - Dash variants mapped to '-', quotes and bullet glyphs removed
 * - Every separator (| _ ~ * , ; : and free-standing hyphens) rewritten to " - "
 * - Whitespace collapsed, trailing separators trimmed
 *
 * Normalizing an already normalized line returns it unchanged.
 */
@Component
public class LineNormalizer {

    public static final String SEPARATOR = " - ";

    private static final Pattern LIST_MARKER = Pattern.compile(
            "^\\s*(?:\\d{1,3}\\.(?!\\d)|\\(\\d{1,3}\\)(?!\\s?\\d)|\\[\\d{1,3}\\]|[-*\\u2022])\\s*"
    );

    // Hyphen, non-breaking hyphen, figure/en/em dash, horizontal bar, minus sign
    private static final Pattern DASH_VARIANTS = Pattern.compile("[\\u2010-\\u2015\\u2212]");

    // Apostrophe inside a word (O'Brien, O’Brien) is kept as a plain apostrophe
    private static final Pattern INNER_APOSTROPHE = Pattern.compile("(?<=[A-Za-z])[\\u2019'](?=[A-Za-z])");

    private static final Pattern QUOTES = Pattern.compile(
            "[\"`\\u201C\\u201D\\u201E\\u201F\\u2018\\u201A\\u201B\\u00AB\\u00BB]|\\u2019|(?<![A-Za-z])'|'(?![A-Za-z])"
    );

    private static final Pattern BULLET_GLYPHS = Pattern.compile("[\\u2022\\u00B7\\u2023\\u2043\\u2219\\u25E6]");

    private static final Pattern ALT_SEPARATORS = Pattern.compile("[|_~*,;:]+");

    private static final Pattern HYPHEN_RUN = Pattern.compile("\\s*-[\\s-]*");

    private static final Pattern TRAILING_SEPARATOR = Pattern.compile("(?:\\s*-)+$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalize a single line.
     *
     * @param line raw line
     * @return normalized line, or the trimmed original when nothing would be left
     */
    public String normalize(String line) {
        if (line == null) {
            return "";
        }
        String original = line.strip();

        String result = stripListMarkers(original);
        result = DASH_VARIANTS.matcher(result).replaceAll("-");
        result = INNER_APOSTROPHE.matcher(result).replaceAll("'");
        result = QUOTES.matcher(result).replaceAll("");
        result = BULLET_GLYPHS.matcher(result).replaceAll(" ");
        result = ALT_SEPARATORS.matcher(result).replaceAll(SEPARATOR);
        result = canonicalizeHyphens(result);
        result = WHITESPACE.matcher(result).replaceAll(" ").strip();

        // Mapping separators can leave a new marker at the start ("| 1. Jane")
        result = stripListMarkers(result);
        result = TRAILING_SEPARATOR.matcher(result).replaceAll("").strip();

        return result.isEmpty() ? original : result;
    }

    private static String stripListMarkers(String text) {
        String result = text;
        String previous;
        do {
            previous = result;
            result = LIST_MARKER.matcher(result).replaceFirst("");
        } while (!result.equals(previous));
        return result;
    }

    private static String canonicalizeHyphens(String text) {
        Matcher matcher = HYPHEN_RUN.matcher(text);
        return matcher.replaceAll(m -> isInnerHyphen(text, m.start(), m.end()) ? "-" : SEPARATOR);
    }

    // Single hyphen between two letters, e.g. "Mary-Jane"
    private static boolean isInnerHyphen(String text, int start, int end) {
        return end - start == 1
                && start > 0
                && end < text.length()
                && Character.isLetter(text.charAt(start - 1))
                && Character.isLetter(text.charAt(end));
    }
}
