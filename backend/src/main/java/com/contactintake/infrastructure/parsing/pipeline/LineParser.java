package com.contactintake.infrastructure.parsing.pipeline;

import com.contactintake.domain.parse.model.CandidateLine;
import com.contactintake.domain.parse.model.ParsedContact;
import com.contactintake.infrastructure.parsing.extraction.NameExtractor;
import com.contactintake.infrastructure.parsing.extraction.PhoneExtractor;
import com.contactintake.infrastructure.parsing.extraction.RoomExtractor;
import com.contactintake.infrastructure.parsing.preprocessing.LineNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses one candidate line:
 * <p>
 * normalize → phone (consume) → room (consume) → strip label residue → name → score
 * </p>
 * A contact is emitted only when a name was found; phone and room are optional.
 */
@Slf4j
@Component
public class LineParser {

    public static final String NO_NAME = "No name detected";
    public static final String NO_PHONE = "No phone number detected";
    public static final String NO_ROOM = "No room number detected";

    private final LineNormalizer lineNormalizer;
    private final PhoneExtractor phoneExtractor;
    private final RoomExtractor roomExtractor;
    private final NameExtractor nameExtractor;
    private final ConfidenceScorer confidenceScorer;
    private final int minLineLength;

    public LineParser(LineNormalizer lineNormalizer,
                      PhoneExtractor phoneExtractor,
                      RoomExtractor roomExtractor,
                      NameExtractor nameExtractor,
                      ConfidenceScorer confidenceScorer,
                      @Value("${contact-parser.min-line-length:2}") int minLineLength) {
        this.lineNormalizer = lineNormalizer;
        this.phoneExtractor = phoneExtractor;
        this.roomExtractor = roomExtractor;
        this.nameExtractor = nameExtractor;
        this.confidenceScorer = confidenceScorer;
        this.minLineLength = minLineLength;
    }

    /**
     * Parse a single raw line, numbered 1.
     */
    public Optional<ParsedContact> parse(String rawLine) {
        return parse(new CandidateLine(1, rawLine == null ? "" : rawLine.strip()));
    }

    /**
     * Parse one candidate line.
     *
     * @param line candidate line
     * @return the contact, or empty when no name could be recovered
     * @throws LineParseException if extraction fails unexpectedly
     */
    public Optional<ParsedContact> parse(CandidateLine line) {
        try {
            return doParse(line);
        } catch (RuntimeException | StackOverflowError e) {
            throw new LineParseException(line.lineNumber(), e.getMessage(), e);
        }
    }

    private Optional<ParsedContact> doParse(CandidateLine line) {
        String text = line.text();
        if (text == null || text.length() < minLineLength) {
            log.debug("[LineParser] Line {} too short, skipped", line.lineNumber());
            return Optional.empty();
        }

        LineParseContext ctx = new LineParseContext(line);
        ctx.setNormalizedText(lineNormalizer.normalize(text));
        ctx.setWorkingText(ctx.getNormalizedText());

        // 1. Phone
        phoneExtractor.extract(ctx.getWorkingText()).ifPresent(phone -> {
            ctx.setPhoneMatch(phone);
            ctx.consume(phone.start(), phone.end());
        });

        // 2. Room
        roomExtractor.extract(ctx.getWorkingText(), ctx.rawPhoneMatches()).ifPresent(room -> {
            ctx.setRoomMatch(room);
            ctx.consume(room.start(), room.end());
        });
        ctx.setWorkingText(roomExtractor.stripLabelResidue(ctx.getWorkingText()));

        // 3. Name
        nameExtractor.extract(ctx.getWorkingText()).ifPresent(ctx::setName);

        collectIssues(ctx);

        if (ctx.getName() == null) {
            log.debug("[LineParser] Line {} dropped: {} ('{}')", line.lineNumber(), ctx.getIssues(), line.originalText());
            return Optional.empty();
        }

        double confidence = confidenceScorer.score(true,
                ctx.getPhoneMatch() != null, ctx.getRoomMatch() != null);
        log.debug("[LineParser] Line {} → name='{}', phone={}, room={}, confidence={}",
                line.lineNumber(), ctx.getName(), ctx.phoneNumber().orElse("-"),
                ctx.roomIdentifier().orElse("-"), confidence);

        return Optional.of(new ParsedContact(
                ctx.getName(),
                ctx.phoneNumber(),
                ctx.roomIdentifier(),
                line.originalText(),
                confidence,
                ctx.getIssues()
        ));
    }

    private static void collectIssues(LineParseContext ctx) {
        List<String> issues = new ArrayList<>();
        if (ctx.getName() == null) {
            issues.add(NO_NAME);
        }
        if (ctx.getPhoneMatch() == null) {
            issues.add(NO_PHONE);
        }
        if (ctx.getRoomMatch() == null) {
            issues.add(NO_ROOM);
        }
        ctx.setIssues(issues);
    }
}
