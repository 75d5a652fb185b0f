package com.koni.greenhouse.infrastructure.persistence.repository;

import com.koni.greenhouse.domain.exception.DuplicateSensorReadingException;
import com.koni.greenhouse.domain.model.SensorReading;
import com.koni.greenhouse.domain.repository.SensorReadingRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the sensor reading adapter against an in-memory database.
 * Tests the unique constraint on (device_id, timestamp) and the filtered listing.
 *
 * Each repository call runs in its own transaction, as it does in the application.
 */
@DataJpaTest
@Import(JpaSensorReadingRepositoryAdapter.class)
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaSensorReadingRepositoryAdapterTest {

    @Autowired
    private SensorReadingRepository sensorReadingRepository;

    @Autowired
    private SensorReadingJpaRepository jpaRepository;

    @AfterEach
    void tearDown() {
        jpaRepository.deleteAll();
    }

    @Test
    void shouldInsertAndAssignIdentifier() {
        // Given
        SensorReading reading = reading("sensor-001", "2024-01-15T10:30:00Z", 22.5, 65.0);

        // When
        SensorReading stored = sensorReadingRepository.insert(reading);

        // Then
        assertThat(stored.getId()).isNotNull();
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(stored.getDeviceId()).isEqualTo("sensor-001");
        assertThat(stored.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
        assertThat(stored.getTemperature()).isEqualTo(22.5);
        assertThat(stored.getHumidity()).isEqualTo(65.0);
    }

    @Test
    void shouldFindReadingByDeviceAndTimestamp() {
        // Given
        SensorReading stored = sensorReadingRepository.insert(
                reading("sensor-001", "2024-01-15T10:30:00Z", 22.5, 65.0));

        // When
        Optional<SensorReading> found = sensorReadingRepository.findByDeviceIdAndTimestamp(
                "sensor-001", Instant.parse("2024-01-15T10:30:00Z"));

        // Then
        assertThat(found).isPresent();
        assertThat(found.get().getId()).isEqualTo(stored.getId());
        assertThat(sensorReadingRepository.findByDeviceIdAndTimestamp(
                "sensor-002", Instant.parse("2024-01-15T10:30:00Z"))).isEmpty();
    }

    @Test
    void shouldRejectSecondReadingForSameDeviceAndTimestamp() {
        // Given
        sensorReadingRepository.insert(reading("sensor-001", "2024-01-15T10:30:00Z", 22.5, 65.0));

        // When/Then - different values, same identity
        assertThatThrownBy(() -> sensorReadingRepository.insert(
                reading("sensor-001", "2024-01-15T10:30:00Z", 30.0, 40.0)))
                .isInstanceOf(DuplicateSensorReadingException.class);

        assertThat(jpaRepository.count()).isEqualTo(1);
        assertThat(sensorReadingRepository.findByDeviceIdAndTimestamp(
                "sensor-001", Instant.parse("2024-01-15T10:30:00Z")).get().getTemperature()).isEqualTo(22.5);
    }

    @Test
    void shouldAllowSameTimestampForDifferentDevices() {
        sensorReadingRepository.insert(reading("sensor-001", "2024-01-15T10:30:00Z", 22.5, 65.0));
        sensorReadingRepository.insert(reading("sensor-002", "2024-01-15T10:30:00Z", 21.0, 60.0));

        assertThat(jpaRepository.count()).isEqualTo(2);
    }

    @Test
    void shouldListNewestFirstWithFilters() {
        // Given
        sensorReadingRepository.insert(reading("sensor-001", "2024-01-15T10:00:00Z", 20.0, 60.0));
        sensorReadingRepository.insert(reading("sensor-001", "2024-01-15T11:00:00Z", 21.0, 61.0));
        sensorReadingRepository.insert(reading("sensor-001", "2024-01-15T12:00:00Z", 22.0, 62.0));
        sensorReadingRepository.insert(reading("sensor-002", "2024-01-15T11:30:00Z", 23.0, 63.0));

        // When
        List<SensorReading> all = sensorReadingRepository.find(null, null, null, 100);
        List<SensorReading> device = sensorReadingRepository.find("sensor-001", null, null, 100);
        List<SensorReading> window = sensorReadingRepository.find("sensor-001",
                Instant.parse("2024-01-15T10:30:00Z"), Instant.parse("2024-01-15T12:00:00Z"), 100);
        List<SensorReading> limited = sensorReadingRepository.find(null, null, null, 2);

        // Then
        assertThat(all).extracting(SensorReading::getTimestamp).containsExactly(
                Instant.parse("2024-01-15T12:00:00Z"),
                Instant.parse("2024-01-15T11:30:00Z"),
                Instant.parse("2024-01-15T11:00:00Z"),
                Instant.parse("2024-01-15T10:00:00Z"));
        assertThat(device).hasSize(3).allMatch(r -> r.getDeviceId().equals("sensor-001"));
        assertThat(window).extracting(SensorReading::getTemperature).containsExactly(22.0, 21.0);
        assertThat(limited).hasSize(2);
    }

    @Test
    void shouldRejectAlreadyStoredReading() {
        SensorReading stored = sensorReadingRepository.insert(
                reading("sensor-001", "2024-01-15T10:30:00Z", 22.5, 65.0));

        assertThatThrownBy(() -> sensorReadingRepository.insert(stored))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static SensorReading reading(String deviceId, String timestamp, double temperature, double humidity) {
        return new SensorReading(deviceId, Instant.parse(timestamp), temperature, humidity, null, null);
    }
}
