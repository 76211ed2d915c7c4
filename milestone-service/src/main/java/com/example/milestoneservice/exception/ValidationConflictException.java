package com.example.milestoneservice.exception;

import org.springframework.http.HttpStatus;

import java.time.LocalDate;

/**
 * A well-formed request that breaks a domain rule against the current state (HTTP 422).
 * Raised before any write happens.
 */
public class ValidationConflictException extends BaseException {

    public ValidationConflictException(String code, String message) {
        super(code, message, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    public static ValidationConflictException completionBeforeStart(LocalDate completionDate,
                                                                    LocalDate startDate) {
        return new ValidationConflictException(
            "COMPLETION_BEFORE_START",
            String.format("The milestone completionDate (%s) should be greater or equal than the startDate (%s).",
                    completionDate, startDate)
        );
    }
}
