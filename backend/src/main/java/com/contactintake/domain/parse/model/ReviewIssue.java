package com.contactintake.domain.parse.model;

/**
 * One field of a reviewed contact that cannot be committed as is.
 *
 * @param field   the offending field
 * @param message short human-readable reason
 */
public record ReviewIssue(
        ReviewField field,
        String message
) {}
