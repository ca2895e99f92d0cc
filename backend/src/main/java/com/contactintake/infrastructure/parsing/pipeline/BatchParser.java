package com.contactintake.infrastructure.parsing.pipeline;

import com.contactintake.domain.parse.model.BatchParseResult;
import com.contactintake.domain.parse.model.CandidateLine;
import com.contactintake.domain.parse.model.LineError;
import com.contactintake.domain.parse.model.ParsedContact;
import com.contactintake.infrastructure.parsing.preprocessing.LineSplitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a whole pasted blob line by line.
 * A line that fails unexpectedly is recorded in {@link BatchParseResult#errors()} and the
 * remaining lines are still parsed; nothing is thrown to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchParser {

    static final String UNKNOWN_ERROR = "Unknown error";

    private final LineSplitter lineSplitter;
    private final LineParser lineParser;

    public BatchParseResult parse(String blob) {
        List<CandidateLine> lines = lineSplitter.split(blob);
        if (lines.isEmpty()) {
            return BatchParseResult.empty();
        }

        List<ParsedContact> contacts = new ArrayList<>();
        List<LineError> errors = new ArrayList<>();

        for (CandidateLine line : lines) {
            try {
                lineParser.parse(line).ifPresent(contacts::add);
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : UNKNOWN_ERROR;
                log.warn("[BatchParser] Line {} failed, continuing: {}", line.lineNumber(), message);
                errors.add(new LineError(line.lineNumber(), message));
            }
        }

        BatchParseResult result = new BatchParseResult(contacts, lines.size(), contacts.size(), errors);
        log.info("[BatchParser] {} lines — parsed={}, dropped={}, errors={}",
                result.totalLines(), result.successfullyParsed(), result.droppedLines(), errors.size());
        return result;
    }
}
