package com.contactintake.infrastructure.parsing.pipeline;

import com.contactintake.domain.parse.model.CandidateLine;
import com.contactintake.domain.parse.model.PhoneMatch;
import com.contactintake.domain.parse.model.RoomMatch;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Mutable working state for one line, passed through the extraction stages.
 * The original line stays untouched; {@code workingText} shrinks as fields are consumed.
 */
@Data
public class LineParseContext {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // --- Input ---
    private final CandidateLine line;

    // --- Preprocessing ---
    private String normalizedText;
    private String workingText;

    // --- Extraction ---
    private PhoneMatch phoneMatch;
    private RoomMatch roomMatch;
    private String name;

    // --- Diagnostics ---
    private List<String> issues = new ArrayList<>();

    /**
     * Remove [start, end) from the working text and tidy the whitespace left behind.
     */
    public void consume(int start, int end) {
        String remaining = workingText.substring(0, start) + " " + workingText.substring(end);
        workingText = WHITESPACE.matcher(remaining).replaceAll(" ").strip();
    }

    public Optional<String> phoneNumber() {
        return Optional.ofNullable(phoneMatch).map(PhoneMatch::normalized);
    }

    public Optional<String> roomIdentifier() {
        return Optional.ofNullable(roomMatch).map(RoomMatch::identifier);
    }

    public List<String> rawPhoneMatches() {
        return phoneMatch != null ? phoneMatch.allMatches() : List.of();
    }
}
