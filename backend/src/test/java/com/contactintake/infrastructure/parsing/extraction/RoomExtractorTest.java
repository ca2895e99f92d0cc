package com.contactintake.infrastructure.parsing.extraction;

import com.contactintake.domain.parse.model.RoomMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomExtractorTest {

    private RoomExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new RoomExtractor();
    }

    @Nested
    @DisplayName("Keyword path")
    class KeywordPath {

        @Test
        void room_label() {
            RoomMatch match = extractor.extract("Room 814 - Jane Doe", List.of()).orElseThrow();

            assertThat(match.identifier()).isEqualTo("814");
            assertThat(match.keyword()).isTrue();
            assertThat(match.start()).isZero();
            assertThat(match.end()).isEqualTo(8);
        }

        @Test
        void label_with_separator() {
            assertThat(extractor.extract("Jane Doe Unit: A12", List.of()))
                    .map(RoomMatch::identifier).contains("A12");
            assertThat(extractor.extract("Jane - Flat - 12B", List.of()))
                    .map(RoomMatch::identifier).contains("12B");
        }

        @Test
        void hash_label() {
            RoomMatch match = extractor.extract("Jane #5", List.of()).orElseThrow();

            assertThat(match.identifier()).isEqualTo("5");
            assertThat(match.start()).isEqualTo(5);
        }

        @Test
        void case_insensitive() {
            assertThat(extractor.extract("rm 7 Jane", List.of()))
                    .map(RoomMatch::identifier).contains("7");
            assertThat(extractor.extract("BLOCK c3 Jane", List.of()))
                    .map(RoomMatch::identifier).contains("c3");
        }

        @Test
        @DisplayName("label must be a whole word")
        void label_whole_word() {
            RoomMatch match = extractor.extract("Roomy 12", List.of()).orElseThrow();

            assertThat(match.identifier()).isEqualTo("12");
            assertThat(match.keyword()).isFalse();
        }

        @Test
        @DisplayName("a token longer than the digit limit is not a room")
        void too_many_digits() {
            assertThat(extractor.extract("Room 81456", List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fallback scan")
    class FallbackScan {

        @Test
        void letter_digit_token() {
            RoomMatch match = extractor.extract("B12", List.of("0735551111", "073555111")).orElseThrow();

            assertThat(match.identifier()).isEqualTo("B12");
            assertThat(match.keyword()).isFalse();
        }

        @Test
        @DisplayName("fragment of a phone match is skipped")
        void phone_fragment_skipped() {
            assertThat(extractor.extract("Jane 12", List.of("0821234512"))).isEmpty();
            assertThat(extractor.extract("Jane 12 14", List.of("0821234512")))
                    .map(RoomMatch::identifier).contains("14");
        }

        @Test
        @DisplayName("candidates at the phone digit threshold are skipped")
        void phone_digit_threshold() {
            RoomExtractor wide = new RoomExtractor(8, 7);

            assertThat(wide.extract("Jane 1234567", List.of())).isEmpty();
            assertThat(wide.extract("Jane 123456", List.of()))
                    .map(RoomMatch::identifier).contains("123456");
        }

        @Test
        void nothing_found() {
            assertThat(extractor.extract("Jane Doe", List.of())).isEmpty();
            assertThat(extractor.extract("", null)).isEmpty();
            assertThat(extractor.extract(null, List.of())).isEmpty();
        }
    }

    @Test
    @DisplayName("leftover room labels are stripped")
    void strip_label_residue() {
        assertThat(extractor.stripLabelResidue("Room - Jane Doe")).isEqualTo("Jane Doe");
        assertThat(extractor.stripLabelResidue("Jane Doe Flat")).isEqualTo("Jane Doe");
        assertThat(extractor.stripLabelResidue("Jane Doe")).isEqualTo("Jane Doe");
    }

    @Test
    void invalid_configuration() {
        assertThatThrownBy(() -> new RoomExtractor(0, 7))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
