package com.contactintake.infrastructure.parsing.preprocessing;

import com.contactintake.domain.parse.model.CandidateLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineSplitterTest {

    private LineSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new LineSplitter();
    }

    @Test
    @DisplayName("null and empty blobs produce no lines")
    void null_and_empty() {
        assertThat(splitter.split(null)).isEmpty();
        assertThat(splitter.split("")).isEmpty();
        assertThat(splitter.split("  \n\t\n ")).isEmpty();
    }

    @Test
    @DisplayName("all line break styles split, blanks dropped, lines trimmed and numbered")
    void split_trim_number() {
        List<CandidateLine> lines = splitter.split("Jane Doe\r\nJohn\rMary\n\n   \n  Peter Pan  ");

        assertThat(lines).containsExactly(
                new CandidateLine(1, "Jane Doe"),
                new CandidateLine(2, "John"),
                new CandidateLine(3, "Mary"),
                new CandidateLine(4, "Peter Pan")
        );
    }

    @Test
    @DisplayName("invisible and control characters are removed from the parse copy only")
    void invisible_and_control_chars() {
        List<CandidateLine> lines = splitter.split("\uFEFFJane\u200B Doe\u0007\n\u200B\n");

        assertThat(lines).containsExactly(
                new CandidateLine(1, "\uFEFFJane\u200B Doe\u0007", "Jane Doe"));
    }

    @Test
    @DisplayName("decomposed accents are composed (NFC)")
    void nfc() {
        List<CandidateLine> lines = splitter.split("Jose\u0301");

        assertThat(lines).extracting(CandidateLine::text).containsExactly("Jos\u00E9");
        assertThat(lines).extracting(CandidateLine::originalText).containsExactly("Jose\u0301");
    }
}
