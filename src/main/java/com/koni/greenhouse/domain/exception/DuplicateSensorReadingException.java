package com.koni.greenhouse.domain.exception;

import java.time.Instant;

/**
 * Exception thrown by the storage layer when a reading for the same device and
 * timestamp already exists. Callers treat it as "already stored", not as a failure.
 */
public class DuplicateSensorReadingException extends RuntimeException {

    private final String deviceId;
    private final Instant timestamp;

    public DuplicateSensorReadingException(String deviceId, Instant timestamp, Throwable cause) {
        super("Sensor reading already exists: deviceId=" + deviceId + ", timestamp=" + timestamp, cause);
        this.deviceId = deviceId;
        this.timestamp = timestamp;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
