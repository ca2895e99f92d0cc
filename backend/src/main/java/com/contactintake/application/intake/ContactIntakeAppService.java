package com.contactintake.application.intake;

import com.contactintake.application.intake.exception.ContactReviewException;
import com.contactintake.domain.parse.model.BatchParseResult;
import com.contactintake.domain.parse.model.ConfidenceBand;
import com.contactintake.domain.parse.model.ContactDraft;
import com.contactintake.domain.parse.model.ParsedContact;
import com.contactintake.domain.parse.model.ReviewIssue;
import com.contactintake.domain.parse.model.ReviewResult;
import com.contactintake.infrastructure.parsing.pipeline.BatchParser;
import com.contactintake.infrastructure.parsing.validation.ContactReviewValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the bulk-add workflow: parse a pasted blob for review, check the reviewed
 * contacts, then turn them into drafts for the contact-creation handler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactIntakeAppService {

    private final BatchParser batchParser;
    private final ContactReviewValidator reviewValidator;

    public BatchParseResult parse(String blob) {
        return batchParser.parse(blob);
    }

    public ReviewResult review(ParsedContact contact) {
        if (contact == null) {
            throw new IllegalArgumentException("Contact is required");
        }
        return reviewValidator.validate(contact);
    }

    public ConfidenceBand confidenceBand(ParsedContact contact) {
        if (contact == null) {
            throw new IllegalArgumentException("Contact is required");
        }
        return reviewValidator.band(contact.confidence());
    }

    /**
     * Build a draft from a reviewed contact plus caller context.
     *
     * @param contact       parsed (possibly user-edited) contact
     * @param groupId       grouping identifier the contact will belong to
     * @param effectiveDate date the contact takes effect
     * @throws ContactReviewException if a field of the contact fails review
     */
    public ContactDraft toDraft(ParsedContact contact, String groupId, LocalDate effectiveDate) {
        validateContext(groupId, effectiveDate);
        ReviewResult review = review(contact);
        if (!review.passed()) {
            throw new ContactReviewException(describe(1, review), review.issues());
        }
        return draftOf(contact, groupId, effectiveDate);
    }

    /**
     * Drafts for every contact of a batch, in line order. Nothing is drafted while any contact
     * fails review.
     *
     * @throws ContactReviewException listing the issues of every failing contact
     */
    public List<ContactDraft> toDrafts(BatchParseResult result, String groupId, LocalDate effectiveDate) {
        validateContext(groupId, effectiveDate);
        if (result == null) {
            return List.of();
        }

        List<ReviewIssue> issues = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        List<ParsedContact> contacts = result.contacts();
        for (int i = 0; i < contacts.size(); i++) {
            ReviewResult review = reviewValidator.validate(contacts.get(i));
            if (!review.passed()) {
                issues.addAll(review.issues());
                messages.add(describe(i + 1, review));
            }
        }
        if (!issues.isEmpty()) {
            log.warn("[ContactIntake] {} of {} contacts failed review for group {}",
                    messages.size(), contacts.size(), groupId);
            throw new ContactReviewException(String.join("; ", messages), issues);
        }

        List<ContactDraft> drafts = contacts.stream()
                .map(contact -> draftOf(contact, groupId, effectiveDate))
                .toList();
        log.info("[ContactIntake] {} drafts prepared for group {}", drafts.size(), groupId);
        return drafts;
    }

    private static ContactDraft draftOf(ParsedContact contact, String groupId, LocalDate effectiveDate) {
        return new ContactDraft(
                contact.name().strip(),
                contact.phoneNumber().map(List::of).orElse(List.of()),
                contact.roomIdentifier().orElse(null),
                groupId,
                effectiveDate
        );
    }

    private static String describe(int position, ReviewResult review) {
        return "Contact " + position + ": " + review.issues().stream()
                .map(ReviewIssue::message)
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
    }

    private static void validateContext(String groupId, LocalDate effectiveDate) {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("Group id is required");
        }
        if (effectiveDate == null) {
            throw new IllegalArgumentException("Effective date is required");
        }
    }
}
