package com.contactintake.application.intake.exception;

import com.contactintake.domain.parse.model.ReviewIssue;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when reviewed contacts are committed while some fields still fail review.
 */
@Getter
public class ContactReviewException extends RuntimeException {

    private final List<ReviewIssue> issues;

    public ContactReviewException(String message, List<ReviewIssue> issues) {
        super(message);
        this.issues = List.copyOf(issues);
    }
}
