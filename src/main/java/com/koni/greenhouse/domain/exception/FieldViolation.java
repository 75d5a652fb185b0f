package com.koni.greenhouse.domain.exception;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single rejected input field and the reason it was rejected.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class FieldViolation {

    private final String field;
    private final String message;
}
