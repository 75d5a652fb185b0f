package com.koni.greenhouse.domain.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when validation of domain input fails.
 * Carries one {@link FieldViolation} per rejected field so that callers can
 * report every problem at once.
 */
public class ValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public ValidationException(String field, String message) {
        this(List.of(new FieldViolation(field, message)));
    }

    public ValidationException(List<FieldViolation> violations) {
        super(violations.stream()
                .map(FieldViolation::getMessage)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
