package com.koni.greenhouse.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * A single measurement reported by a greenhouse sensor.
 * Readings are immutable once stored; the pair (deviceId, timestamp) identifies
 * a reading from the device's point of view.
 */
@Getter
@EqualsAndHashCode(of = {"deviceId", "timestamp"})
public class SensorReading {

    private final UUID id;
    private final String deviceId;
    private final Instant timestamp;
    private final Double temperature;
    private final Double humidity;
    private final Double battery;
    private final Map<String, Object> raw;
    private final Instant createdAt;

    /**
     * Creates a reading that has not been stored yet.
     * The identifier and creation instant are assigned by the storage layer.
     *
     * @param deviceId the reporting device
     * @param timestamp the instant the measurement was taken
     * @param temperature temperature in degrees Celsius
     * @param humidity relative humidity, never negative
     * @param battery battery level, may be {@code null}
     * @param raw free-form payload as reported by the device, may be {@code null}
     */
    public SensorReading(String deviceId, Instant timestamp, Double temperature, Double humidity,
                         Double battery, Map<String, Object> raw) {
        this(null, deviceId, timestamp, temperature, humidity, battery, raw, null);
    }

    public SensorReading(UUID id, String deviceId, Instant timestamp, Double temperature, Double humidity,
                         Double battery, Map<String, Object> raw, Instant createdAt) {
        this.id = id;
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.temperature = temperature;
        this.humidity = humidity;
        this.battery = battery;
        this.raw = raw == null ? null : Collections.unmodifiableMap(raw);
        this.createdAt = createdAt;
    }

    public boolean isStored() {
        return id != null;
    }

    @Override
    public String toString() {
        return "SensorReading{" +
                "id=" + id +
                ", deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", temperature=" + temperature +
                ", humidity=" + humidity +
                ", battery=" + battery +
                '}';
    }
}
