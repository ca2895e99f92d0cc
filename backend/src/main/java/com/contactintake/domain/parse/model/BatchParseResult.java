package com.contactintake.domain.parse.model;

import java.util.List;

/**
 * Aggregate outcome of parsing one pasted blob.
 *
 * @param contacts           emitted contacts, in input line order
 * @param totalLines         number of non-blank lines considered
 * @param successfullyParsed number of lines that produced a contact
 * @param errors             lines that failed unexpectedly, in input line order
 */
public record BatchParseResult(
        List<ParsedContact> contacts,
        int totalLines,
        int successfullyParsed,
        List<LineError> errors
) {
    public BatchParseResult {
        contacts = List.copyOf(contacts);
        errors = List.copyOf(errors);
    }

    public static BatchParseResult empty() {
        return new BatchParseResult(List.of(), 0, 0, List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Lines that neither produced a contact nor failed, i.e. no name was found.
     */
    public int droppedLines() {
        return totalLines - successfullyParsed - errors.size();
    }

    public List<String> errorMessages() {
        return errors.stream().map(LineError::formatted).toList();
    }
}
