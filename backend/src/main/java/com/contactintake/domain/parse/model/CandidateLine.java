package com.contactintake.domain.parse.model;

/**
 * One non-blank line of a pasted blob.
 *
 * @param lineNumber   1-based position among the non-blank lines of the blob
 * @param originalText the trimmed line exactly as pasted, kept for diagnostics
 * @param text         the same line with invisible and control characters removed; what gets parsed
 */
public record CandidateLine(
        int lineNumber,
        String originalText,
        String text
) {

    public CandidateLine(int lineNumber, String text) {
        this(lineNumber, text, text);
    }
}
