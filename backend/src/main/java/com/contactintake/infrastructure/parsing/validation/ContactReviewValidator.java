package com.contactintake.infrastructure.parsing.validation;

import com.contactintake.domain.parse.model.ConfidenceBand;
import com.contactintake.domain.parse.model.ParsedContact;
import com.contactintake.domain.parse.model.ReviewField;
import com.contactintake.domain.parse.model.ReviewIssue;
import com.contactintake.domain.parse.model.ReviewResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks a contact, as edited during review, before it is committed:
 * - Name required
 * - Phone, with spaces and hyphens removed, is an optional '+' and a bounded digit count
 * - Room no longer than the configured length
 *
 * Also sorts parser confidence into review bands.
 */
@Slf4j
@Component
public class ContactReviewValidator {

    static final String NAME_REQUIRED = "Name required";
    static final String INVALID_PHONE = "Invalid phone";
    static final String ROOM_TOO_LONG = "Too long";

    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s-]");

    private final int roomMaxLength;
    private final double highConfidence;
    private final double mediumConfidence;
    private final Pattern phonePattern;

    public ContactReviewValidator() {
        this(8, 15, 10, 0.8, 0.6);
    }

    @Autowired
    public ContactReviewValidator(
            @Value("${contact-parser.review.phone-min-digits:8}") int phoneMinDigits,
            @Value("${contact-parser.review.phone-max-digits:15}") int phoneMaxDigits,
            @Value("${contact-parser.review.room-max-length:10}") int roomMaxLength,
            @Value("${contact-parser.review.high-confidence:0.8}") double highConfidence,
            @Value("${contact-parser.review.medium-confidence:0.6}") double mediumConfidence) {
        if (phoneMinDigits < 1 || phoneMaxDigits < phoneMinDigits) {
            throw new IllegalArgumentException(
                    "Phone digit bounds must satisfy 1 <= min <= max: " + phoneMinDigits + ".." + phoneMaxDigits);
        }
        if (roomMaxLength < 1) {
            throw new IllegalArgumentException("Room max length must be positive: " + roomMaxLength);
        }
        if (mediumConfidence > highConfidence) {
            throw new IllegalArgumentException(
                    "Medium confidence threshold above high: " + mediumConfidence + " > " + highConfidence);
        }
        this.roomMaxLength = roomMaxLength;
        this.highConfidence = highConfidence;
        this.mediumConfidence = mediumConfidence;
        this.phonePattern = Pattern.compile("\\+?\\d{" + phoneMinDigits + "," + phoneMaxDigits + "}");
    }

    public ReviewResult validate(ParsedContact contact) {
        return validate(contact.name(),
                contact.phoneNumber().orElse(null),
                contact.roomIdentifier().orElse(null));
    }

    /**
     * Validate edited field values; blank phone and room count as absent.
     */
    public ReviewResult validate(String name, String phoneNumber, String roomIdentifier) {
        List<ReviewIssue> issues = new ArrayList<>();
        if (name == null || name.isBlank()) {
            issues.add(new ReviewIssue(ReviewField.NAME, NAME_REQUIRED));
        }
        if (phoneNumber != null) {
            String phone = PHONE_SEPARATORS.matcher(phoneNumber).replaceAll("");
            if (!phone.isEmpty() && !phonePattern.matcher(phone).matches()) {
                issues.add(new ReviewIssue(ReviewField.PHONE_NUMBER, INVALID_PHONE));
            }
        }
        if (roomIdentifier != null && roomIdentifier.length() > roomMaxLength) {
            issues.add(new ReviewIssue(ReviewField.ROOM_IDENTIFIER, ROOM_TOO_LONG));
        }

        if (!issues.isEmpty()) {
            log.debug("[ReviewValidator] {} field issue(s): {}", issues.size(), issues);
        }
        return ReviewResult.of(issues);
    }

    public ConfidenceBand band(double confidence) {
        if (confidence >= highConfidence) {
            return ConfidenceBand.HIGH;
        }
        if (confidence >= mediumConfidence) {
            return ConfidenceBand.MEDIUM;
        }
        return ConfidenceBand.LOW;
    }
}
