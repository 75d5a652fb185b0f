package com.koni.greenhouse.infrastructure.web.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must be an ISO-8601 date-time.
 * {@code null} and blank values are accepted; combine with {@code @NotBlank} to require a value.
 */
@Documented
@Constraint(validatedBy = IsoTimestampValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface IsoTimestamp {

    String message() default "must be a valid ISO8601 date-time";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
