package com.koni.greenhouse.infrastructure.web.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IsoTimestampValidatorTest {

    private final IsoTimestampValidator validator = new IsoTimestampValidator();

    @Test
    void shouldAcceptIsoDateTimes() {
        assertThat(validator.isValid("2025-12-26T20:00:00Z", null)).isTrue();
        assertThat(validator.isValid("2025-12-26T21:00:00+01:00", null)).isTrue();
        assertThat(validator.isValid("2025-12-26T20:00:00", null)).isTrue();
    }

    @Test
    void shouldRejectOtherText() {
        assertThat(validator.isValid("not-a-date", null)).isFalse();
        assertThat(validator.isValid("2025-12-26", null)).isFalse();
        assertThat(validator.isValid("yesterday", null)).isFalse();
    }

    @Test
    void shouldLeaveMissingValuesToNotBlank() {
        assertThat(validator.isValid(null, null)).isTrue();
        assertThat(validator.isValid("  ", null)).isTrue();
    }
}
