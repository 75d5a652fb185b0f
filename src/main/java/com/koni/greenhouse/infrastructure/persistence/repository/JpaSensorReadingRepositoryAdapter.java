package com.koni.greenhouse.infrastructure.persistence.repository;

import com.koni.greenhouse.domain.exception.DuplicateSensorReadingException;
import com.koni.greenhouse.domain.model.SensorReading;
import com.koni.greenhouse.domain.repository.SensorReadingRepository;
import com.koni.greenhouse.infrastructure.persistence.entity.SensorReadingEntity;
import io.micrometer.tracing.annotation.ContinueSpan;
import io.micrometer.tracing.annotation.SpanTag;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA adapter for SensorReadingRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * It handles mapping between domain models (SensorReading) and JPA entities (SensorReadingEntity)
 * and translates storage failures into domain exceptions.
 */
@Component
@RequiredArgsConstructor
public class JpaSensorReadingRepositoryAdapter implements SensorReadingRepository {

    private final SensorReadingJpaRepository jpaRepository;

    @Override
    @ContinueSpan(log = "sensor-reading-find")
    public Optional<SensorReading> findByDeviceIdAndTimestamp(@SpanTag("deviceId") String deviceId,
                                                              Instant timestamp) {
        if (deviceId == null || timestamp == null) {
            throw new IllegalArgumentException("DeviceId and timestamp cannot be null");
        }

        return StorageFailures.translate("sensor reading lookup",
                () -> jpaRepository.findByDeviceIdAndTimestamp(deviceId, timestamp).map(this::toDomain));
    }

    /**
     * Inserts the reading and flushes immediately so that a unique constraint
     * violation surfaces here rather than at commit.
     */
    @Override
    @ContinueSpan(log = "sensor-reading-insert")
    public SensorReading insert(SensorReading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("SensorReading cannot be null");
        }
        if (reading.isStored()) {
            throw new IllegalArgumentException("SensorReading is already stored: " + reading.getId());
        }

        try {
            return StorageFailures.translate("sensor reading insert",
                    () -> toDomain(jpaRepository.saveAndFlush(toEntity(reading))));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSensorReadingException(reading.getDeviceId(), reading.getTimestamp(), e);
        }
    }

    /**
     * An upper bound is only applied together with a lower bound.
     */
    @Override
    @ContinueSpan(log = "sensor-reading-list")
    public List<SensorReading> find(@SpanTag("deviceId") String deviceId, Instant from, Instant to, int limit) {
        return StorageFailures.translate("sensor reading listing",
                () -> findEntities(deviceId, from, to, PageRequest.of(0, limit)).stream()
                        .map(this::toDomain)
                        .collect(Collectors.toList()));
    }

    private List<SensorReadingEntity> findEntities(String deviceId, Instant from, Instant to, Pageable page) {
        if (deviceId == null) {
            if (from == null) {
                return jpaRepository.findAllByOrderByTimestampDesc(page);
            }
            return to == null
                    ? jpaRepository.findByTimestampGreaterThanEqualOrderByTimestampDesc(from, page)
                    : jpaRepository.findByTimestampBetweenOrderByTimestampDesc(from, to, page);
        }
        if (from == null) {
            return jpaRepository.findByDeviceIdOrderByTimestampDesc(deviceId, page);
        }
        return to == null
                ? jpaRepository.findByDeviceIdAndTimestampGreaterThanEqualOrderByTimestampDesc(deviceId, from, page)
                : jpaRepository.findByDeviceIdAndTimestampBetweenOrderByTimestampDesc(deviceId, from, to, page);
    }

    private SensorReading toDomain(SensorReadingEntity entity) {
        return new SensorReading(
            entity.getId(),
            entity.getDeviceId(),
            entity.getTimestamp(),
            entity.getTemperature(),
            entity.getHumidity(),
            entity.getBattery(),
            entity.getRaw(),
            entity.getCreatedAt()
        );
    }

    private SensorReadingEntity toEntity(SensorReading reading) {
        return new SensorReadingEntity(
            reading.getDeviceId(),
            reading.getTimestamp(),
            reading.getTemperature(),
            reading.getHumidity(),
            reading.getBattery(),
            reading.getRaw() == null ? null : new HashMap<>(reading.getRaw())
        );
    }
}
