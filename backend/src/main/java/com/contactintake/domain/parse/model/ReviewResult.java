package com.contactintake.domain.parse.model;

import java.util.List;

/**
 * Result of reviewing one contact before commit.
 *
 * @param passed true if no field failed
 * @param issues failed fields, at most one per field
 */
public record ReviewResult(
        boolean passed,
        List<ReviewIssue> issues
) {
    public ReviewResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ReviewResult of(List<ReviewIssue> issues) {
        return new ReviewResult(issues == null || issues.isEmpty(), issues);
    }

    public boolean hasIssue(ReviewField field) {
        return issues.stream().anyMatch(i -> i.field() == field);
    }
}
