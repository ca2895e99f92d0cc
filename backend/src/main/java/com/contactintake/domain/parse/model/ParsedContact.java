package com.contactintake.domain.parse.model;

import java.util.List;
import java.util.Optional;

/**
 * Contact recovered from a single pasted line.
 *
 * @param name           extracted display name, never blank for an emitted contact
 * @param phoneNumber    normalized phone number, if a phone shape matched
 * @param roomIdentifier short room/unit token, if one was found
 * @param rawText        the original line, unmodified
 * @param confidence     completeness score in [0.0, 1.0]
 * @param issues         soft misses, e.g. "No phone number detected"
 */
public record ParsedContact(
        String name,
        Optional<String> phoneNumber,
        Optional<String> roomIdentifier,
        String rawText,
        double confidence,
        List<String> issues
) {
    public ParsedContact {
        phoneNumber = phoneNumber == null ? Optional.empty() : phoneNumber;
        roomIdentifier = roomIdentifier == null ? Optional.empty() : roomIdentifier;
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasPhoneNumber() {
        return phoneNumber.isPresent();
    }

    public boolean hasRoomIdentifier() {
        return roomIdentifier.isPresent();
    }
}
