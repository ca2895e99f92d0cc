package com.contactintake.infrastructure.parsing.pipeline;

import lombok.Getter;

/**
 * Unexpected failure while extracting fields from one line.
 */
@Getter
public class LineParseException extends RuntimeException {

    private final int lineNumber;

    public LineParseException(int lineNumber, String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }
}
