package com.koni.greenhouse.domain.repository;

import com.koni.greenhouse.domain.model.DeviceCommand;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for DeviceCommand persistence operations.
 */
public interface DeviceCommandRepository {

    /**
     * Stores a new command or records the status of an existing one.
     *
     * @param command the command to save
     * @return the stored command; a new command comes back with its identifier and creation instant
     * @throws com.koni.greenhouse.domain.exception.DatabaseUnavailableException if the database cannot be reached
     */
    DeviceCommand save(DeviceCommand command);

    Optional<DeviceCommand> findById(UUID id);

    /**
     * Returns the most recent commands for a device, newest first.
     *
     * @param deviceId the target device
     * @param limit maximum number of commands to return
     * @return the command history, possibly empty
     */
    List<DeviceCommand> findRecentByDeviceId(String deviceId, int limit);
}
