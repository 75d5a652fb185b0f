package com.koni.greenhouse.domain.repository;

import com.koni.greenhouse.domain.model.SensorReading;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for SensorReading persistence operations.
 * This interface is part of the domain layer and defines the contract
 * for sensor data access without coupling to specific infrastructure implementations.
 *
 * Implementations must enforce uniqueness of (deviceId, timestamp) in the store itself
 * and report a violation as a {@link com.koni.greenhouse.domain.exception.DuplicateSensorReadingException}.
 */
public interface SensorReadingRepository {

    /**
     * Finds the reading stored for exactly this device and timestamp.
     *
     * @param deviceId the reporting device
     * @param timestamp the instant the measurement was taken
     * @return the stored reading, or empty if none exists
     * @throws com.koni.greenhouse.domain.exception.DatabaseUnavailableException if the database cannot be reached
     */
    Optional<SensorReading> findByDeviceIdAndTimestamp(String deviceId, Instant timestamp);

    /**
     * Inserts a new reading. Never updates an existing one.
     *
     * @param reading the unsaved reading
     * @return the stored reading with its generated identifier and creation instant
     * @throws com.koni.greenhouse.domain.exception.DuplicateSensorReadingException if a reading for the
     *         same device and timestamp already exists
     * @throws com.koni.greenhouse.domain.exception.DatabaseUnavailableException if the database cannot be reached
     */
    SensorReading insert(SensorReading reading);

    /**
     * Lists readings newest first.
     *
     * @param deviceId restrict to this device, or {@code null} for all devices
     * @param from inclusive lower bound on the timestamp, or {@code null}
     * @param to inclusive upper bound on the timestamp, or {@code null}
     * @param limit maximum number of readings to return
     * @return matching readings, possibly empty
     */
    List<SensorReading> find(String deviceId, Instant from, Instant to, int limit);
}
