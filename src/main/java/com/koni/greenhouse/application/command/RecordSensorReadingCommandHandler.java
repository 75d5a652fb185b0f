package com.koni.greenhouse.application.command;

import com.koni.greenhouse.domain.exception.DuplicateSensorReadingException;
import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.domain.model.SensorReading;
import com.koni.greenhouse.domain.model.Timestamps;
import com.koni.greenhouse.domain.repository.SensorReadingRepository;
import com.koni.greenhouse.infrastructure.observability.GreenhouseMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command handler for recording sensor readings.
 *
 * Responsibilities:
 * - Validate the reported values
 * - Return the already stored reading for a repeated (deviceId, timestamp) submission
 * - Insert a new reading otherwise
 *
 * The lookup and the insert run in separate transactions. The unique constraint on
 * (device_id, timestamp) decides concurrent submissions and the loser re-reads the
 * winner's row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordSensorReadingCommandHandler {

    static final int MAX_DEVICE_ID_LENGTH = 255;

    private final SensorReadingRepository sensorReadingRepository;
    private final GreenhouseMetrics metrics;

    /**
     * Handles the RecordSensorReadingCommand. Repeating a submission is a no-op that
     * returns the original reading; the first write wins even if the values differ.
     *
     * @param command the reading to record
     * @return the stored reading and whether this call created it
     * @throws ValidationException if the command violates input rules
     * @throws com.koni.greenhouse.domain.exception.DatabaseUnavailableException if the database cannot be reached
     */
    @Observed(name = "command.handler", contextualName = "record-sensor-reading")
    public SensorIngestionResult handle(RecordSensorReadingCommand command) {
        log.debug("Handling RecordSensorReadingCommand: deviceId={}, timestamp={}",
                command.getDeviceId(), command.getTimestamp());

        return metrics.recordIngestionTime(() -> {
            metrics.recordReadingReceived();

            SensorReading reading = toReading(command);

            Optional<SensorReading> existing = sensorReadingRepository
                    .findByDeviceIdAndTimestamp(reading.getDeviceId(), reading.getTimestamp());
            if (existing.isPresent()) {
                log.info("Sensor reading already stored: deviceId={}, timestamp={}, id={}",
                        reading.getDeviceId(), reading.getTimestamp(), existing.get().getId());
                metrics.recordDuplicate();
                return SensorIngestionResult.existing(existing.get());
            }

            try {
                SensorReading stored = sensorReadingRepository.insert(reading);
                metrics.recordReadingCreated();
                log.info("Sensor reading saved: id={}, deviceId={}, timestamp={}",
                        stored.getId(), stored.getDeviceId(), stored.getTimestamp());
                return SensorIngestionResult.created(stored);
            } catch (DuplicateSensorReadingException e) {
                log.info("Concurrent submission stored first: deviceId={}, timestamp={}",
                        reading.getDeviceId(), reading.getTimestamp());
                metrics.recordDuplicate();
                SensorReading winner = sensorReadingRepository
                        .findByDeviceIdAndTimestamp(reading.getDeviceId(), reading.getTimestamp())
                        .orElseThrow(() -> new IllegalStateException(
                                "Unique constraint reported a duplicate that cannot be read back", e));
                return SensorIngestionResult.existing(winner);
            }
        });
    }

    private SensorReading toReading(RecordSensorReadingCommand command) {
        List<FieldViolation> violations = new ArrayList<>();

        String deviceId = command.getDeviceId();
        if (deviceId == null || deviceId.isBlank()) {
            violations.add(new FieldViolation("device_id", "device_id is required"));
        } else if (deviceId.length() > MAX_DEVICE_ID_LENGTH) {
            violations.add(new FieldViolation("device_id",
                    "device_id must be at most " + MAX_DEVICE_ID_LENGTH + " characters"));
        }

        Optional<Instant> timestamp = Timestamps.parse(command.getTimestamp());
        if (timestamp.isEmpty()) {
            violations.add(new FieldViolation("timestamp", "timestamp must be a valid ISO8601 format"));
        }

        if (command.getTemperature() == null) {
            violations.add(new FieldViolation("temperature", "temperature is required"));
        }

        if (command.getHumidity() == null) {
            violations.add(new FieldViolation("humidity", "humidity is required"));
        } else if (command.getHumidity() < 0) {
            violations.add(new FieldViolation("humidity", "humidity must be a positive number"));
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        return new SensorReading(
                deviceId,
                timestamp.get(),
                command.getTemperature(),
                command.getHumidity(),
                command.getBattery(),
                command.getRaw()
        );
    }
}
