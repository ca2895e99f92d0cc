package com.contactintake.domain.parse.model;

import java.util.List;

/**
 * Phone number chosen for a line.
 *
 * @param rawText    the matched substring, before normalization
 * @param normalized the normalized number (the raw text when no shape applies)
 * @param start      start offset of the match in the searched text
 * @param end        end offset (exclusive)
 * @param allMatches every raw substring any phone shape matched, in pattern order
 */
public record PhoneMatch(
        String rawText,
        String normalized,
        int start,
        int end,
        List<String> allMatches
) {
    public PhoneMatch {
        allMatches = List.copyOf(allMatches);
    }
}
