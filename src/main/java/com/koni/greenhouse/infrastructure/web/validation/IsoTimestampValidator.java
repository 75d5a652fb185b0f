package com.koni.greenhouse.infrastructure.web.validation;

import com.koni.greenhouse.domain.model.Timestamps;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Checks {@link IsoTimestamp} with the same parser the command handlers use.
 */
public class IsoTimestampValidator implements ConstraintValidator<IsoTimestamp, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return true;
        }
        return Timestamps.parse(value).isPresent();
    }
}
