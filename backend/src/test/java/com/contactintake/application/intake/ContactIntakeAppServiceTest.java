package com.contactintake.application.intake;

import com.contactintake.application.intake.exception.ContactReviewException;
import com.contactintake.domain.parse.model.BatchParseResult;
import com.contactintake.domain.parse.model.ConfidenceBand;
import com.contactintake.domain.parse.model.ContactDraft;
import com.contactintake.domain.parse.model.ParsedContact;
import com.contactintake.domain.parse.model.ReviewField;
import com.contactintake.domain.parse.model.ReviewIssue;
import com.contactintake.infrastructure.parsing.pipeline.BatchParser;
import com.contactintake.infrastructure.parsing.validation.ContactReviewValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContactIntakeAppServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 3, 9);

    @Mock
    private BatchParser batchParser;

    private ContactIntakeAppService service;

    @BeforeEach
    void setUp() {
        service = new ContactIntakeAppService(batchParser, new ContactReviewValidator());
    }

    private static ParsedContact contact(String name, String phone, String room) {
        return new ParsedContact(name, Optional.ofNullable(phone), Optional.ofNullable(room),
                name, 0.5, List.of());
    }

    @Test
    @DisplayName("parse delegates to the batch parser")
    void parse_delegates() {
        BatchParseResult expected = new BatchParseResult(
                List.of(contact("Jane Doe", "+27821234567", "814")), 1, 1, List.of());
        when(batchParser.parse("blob")).thenReturn(expected);

        assertThat(service.parse("blob")).isSameAs(expected);
    }

    @Test
    @DisplayName("draft carries fields plus caller context")
    void to_draft() {
        ContactDraft draft = service.toDraft(contact("Jane Doe", "+27821234567", "814"), "group-1", DATE);

        assertThat(draft).isEqualTo(new ContactDraft(
                "Jane Doe", List.of("+27821234567"), "814", "group-1", DATE));
    }

    @Test
    @DisplayName("missing phone and room become empty list and null")
    void to_draft_optional_fields() {
        ContactDraft draft = service.toDraft(contact("John", null, null), "group-1", DATE);

        assertThat(draft.phoneNumbers()).isEmpty();
        assertThat(draft.roomIdentifier()).isNull();
    }

    @Test
    @DisplayName("name blanked during review blocks the draft")
    void to_draft_blank_name() {
        ContactReviewException e = catchThrowableOfType(
                () -> service.toDraft(contact(" ", null, "5"), "group-1", DATE), ContactReviewException.class);

        assertThat(e).hasMessage("Contact 1: Name required");
        assertThat(e.getIssues()).extracting(ReviewIssue::field).containsExactly(ReviewField.NAME);
    }

    @Test
    @DisplayName("an edited phone with spaces and hyphens is accepted")
    void to_draft_edited_phone() {
        ContactDraft draft = service.toDraft(contact("Jane Doe", "+27 82-123 4567", null), "group-1", DATE);

        assertThat(draft.phoneNumbers()).containsExactly("+27 82-123 4567");
    }

    @Test
    @DisplayName("one invalid contact blocks the whole batch and is reported by position")
    void to_drafts_blocked_by_review() {
        BatchParseResult result = new BatchParseResult(List.of(
                contact("Zed Zulu", "+27821111111", "5"),
                contact("Amy Adams", "12345", "Penthouse-North"),
                contact("Mia Moss", null, null)), 3, 3, List.of());

        ContactReviewException e = catchThrowableOfType(
                () -> service.toDrafts(result, "group-1", DATE), ContactReviewException.class);

        assertThat(e).hasMessage("Contact 2: Invalid phone, Too long");
        assertThat(e.getIssues()).extracting(ReviewIssue::field)
                .containsExactly(ReviewField.PHONE_NUMBER, ReviewField.ROOM_IDENTIFIER);
    }

    @Test
    void review_and_band() {
        ParsedContact contact = new ParsedContact("Jane Doe", Optional.of("+27821234567"), Optional.empty(),
                "Jane Doe 0821234567", 0.8, List.of());

        assertThat(service.review(contact).passed()).isTrue();
        assertThat(service.confidenceBand(contact)).isEqualTo(ConfidenceBand.HIGH);
    }

    @Test
    void to_drafts_keeps_order() {
        BatchParseResult result = new BatchParseResult(
                List.of(contact("Zed Zulu", null, null), contact("Amy Adams", null, null)), 3, 2, List.of());

        assertThat(service.toDrafts(result, "group-1", DATE))
                .extracting(ContactDraft::name)
                .containsExactly("Zed Zulu", "Amy Adams");
        assertThat(service.toDrafts(null, "group-1", DATE)).isEmpty();
    }

    @Test
    @DisplayName("caller context is required")
    void context_required() {
        ParsedContact contact = contact("Jane Doe", null, null);

        assertThatThrownBy(() -> service.toDraft(contact, " ", DATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.toDraft(contact, "group-1", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.toDraft(null, "group-1", DATE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
