package com.contactintake.domain.parse.model;

/**
 * A line whose extraction failed unexpectedly.
 *
 * @param lineNumber 1-based position among the non-blank lines of the blob
 * @param message    failure message
 */
public record LineError(
        int lineNumber,
        String message
) {
    public String formatted() {
        return "Line " + lineNumber + ": " + message;
    }
}
