package com.koni.greenhouse.domain.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Parsing of device-reported timestamps.
 * Accepts ISO-8601 date-times with {@code Z}, an offset or a region id; a date-time
 * without zone information is read as UTC.
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * Parses an ISO-8601 date-time.
     *
     * @param text the text to parse, may be {@code null}
     * @return the instant, or empty if the text is missing or not a valid date-time
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text.trim(), ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return Optional.of(((ZonedDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
