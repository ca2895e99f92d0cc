package com.contactintake.infrastructure.parsing.preprocessing;

import com.contactintake.domain.parse.model.CandidateLine;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a pasted blob into candidate lines:
 * - Line break split (\r\n, \r, \n, U+2028, U+2029), trim, blank lines dropped
 * - Per line, a parse copy with Unicode NFC normalization and invisible/control characters removed
 *
 * The trimmed line as pasted is kept alongside the parse copy.
 */
@Component
public class LineSplitter {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \t, \n, \r
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|[\\r\\n\\u2028\\u2029]");

    /**
     * Split the blob into non-blank, trimmed lines.
     *
     * @param blob raw pasted text, may be null
     * @return candidate lines numbered from 1, in input order
     */
    public List<CandidateLine> split(String blob) {
        if (blob == null || blob.isEmpty()) {
            return List.of();
        }

        List<CandidateLine> lines = new ArrayList<>();
        for (String raw : LINE_BREAK.split(blob)) {
            String sanitized = sanitize(raw);
            if (!sanitized.isEmpty()) {
                lines.add(new CandidateLine(lines.size() + 1, raw.strip(), sanitized));
            }
        }
        return lines;
    }

    private static String sanitize(String line) {
        String text = Normalizer.normalize(line, Normalizer.Form.NFC);
        text = INVISIBLE_CHARS.matcher(text).replaceAll("");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        return text.strip();
    }
}
