package com.koni.greenhouse.infrastructure.persistence.repository;

import com.koni.greenhouse.infrastructure.persistence.entity.SensorReadingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA repository for SensorReadingEntity persistence operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime,
 * providing standard CRUD operations and custom query methods.
 */
@Repository
public interface SensorReadingJpaRepository extends JpaRepository<SensorReadingEntity, UUID> {

    /**
     * Finds the reading for a device at an exact timestamp.
     * Backed by the unique constraint on (device_id, timestamp).
     */
    Optional<SensorReadingEntity> findByDeviceIdAndTimestamp(String deviceId, Instant timestamp);

    List<SensorReadingEntity> findAllByOrderByTimestampDesc(Pageable pageable);

    List<SensorReadingEntity> findByDeviceIdOrderByTimestampDesc(String deviceId, Pageable pageable);

    List<SensorReadingEntity> findByTimestampGreaterThanEqualOrderByTimestampDesc(Instant from, Pageable pageable);

    List<SensorReadingEntity> findByTimestampBetweenOrderByTimestampDesc(Instant from, Instant to, Pageable pageable);

    List<SensorReadingEntity> findByDeviceIdAndTimestampGreaterThanEqualOrderByTimestampDesc(
            String deviceId, Instant from, Pageable pageable);

    /**
     * Readings of one device within an inclusive time range, newest first.
     * The page size of {@code pageable} is the row limit.
     */
    List<SensorReadingEntity> findByDeviceIdAndTimestampBetweenOrderByTimestampDesc(
            String deviceId, Instant from, Instant to, Pageable pageable);
}
