package com.contactintake.domain.parse.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Reviewed contact ready to be handed to a contact-creation handler.
 * Carries only caller-supplied context; no identifiers or timestamps.
 */
public record ContactDraft(
        String name,
        List<String> phoneNumbers,
        String roomIdentifier,
        String groupId,
        LocalDate effectiveDate
) {
    public ContactDraft {
        phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
    }
}
