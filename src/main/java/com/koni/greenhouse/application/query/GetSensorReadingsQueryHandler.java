package com.koni.greenhouse.application.query;

import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.domain.model.Timestamps;
import com.koni.greenhouse.domain.repository.SensorReadingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Query handler for listing sensor readings.
 *
 * An end date is only applied together with a start date; the range is inclusive.
 */
@Slf4j
@Service
public class GetSensorReadingsQueryHandler {

    static final int MAX_LIMIT = 1000;

    private final SensorReadingRepository repository;
    private final int defaultLimit;

    public GetSensorReadingsQueryHandler(
            SensorReadingRepository repository,
            @Value("${greenhouse.sensors.default-limit:100}") int defaultLimit) {
        this.repository = repository;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Handles the GetSensorReadingsQuery.
     *
     * @param query the filters
     * @return matching readings, newest first, or an empty list
     * @throws ValidationException if a date is not ISO-8601 or the limit is out of range
     */
    public List<SensorReadingResponse> handle(GetSensorReadingsQuery query) {
        List<FieldViolation> violations = new ArrayList<>();

        Instant from = parseOptional(query.getStartDate(), "startDate", violations);
        Instant to = parseOptional(query.getEndDate(), "endDate", violations);
        int limit = query.getLimit() == null ? defaultLimit : query.getLimit();
        if (limit < 1 || limit > MAX_LIMIT) {
            violations.add(new FieldViolation("limit", "limit must be between 1 and " + MAX_LIMIT));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        if (from == null) {
            to = null;
        }

        String deviceId = query.getDeviceId() == null || query.getDeviceId().isBlank() ? null : query.getDeviceId();
        log.debug("Handling GetSensorReadingsQuery: deviceId={}, from={}, to={}, limit={}", deviceId, from, to, limit);

        List<SensorReadingResponse> readings = repository.find(deviceId, from, to, limit).stream()
                .map(SensorReadingResponse::from)
                .collect(Collectors.toList());

        log.info("Retrieved {} sensor readings", readings.size());
        return readings;
    }

    private static Instant parseOptional(String text, String field, List<FieldViolation> violations) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Optional<Instant> parsed = Timestamps.parse(text);
        if (parsed.isEmpty()) {
            violations.add(new FieldViolation(field, field + " must be a valid ISO8601 format"));
            return null;
        }
        return parsed.get();
    }
}
