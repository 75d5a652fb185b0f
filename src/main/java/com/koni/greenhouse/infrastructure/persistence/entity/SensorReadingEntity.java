package com.koni.greenhouse.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for persisting sensor readings.
 * The unique constraint on (device_id, timestamp) is what makes ingestion idempotent
 * under concurrent submissions.
 */
@Entity
@Table(
    name = "sensor_readings",
    uniqueConstraints = {
        @UniqueConstraint(
            name = "uq_sensor_readings_device_id_timestamp",
            columnNames = {"device_id", "timestamp"}
        )
    },
    indexes = {
        @Index(name = "idx_sensor_readings_device_id", columnList = "device_id"),
        @Index(name = "idx_sensor_readings_timestamp", columnList = "timestamp")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SensorReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "device_id", nullable = false, length = 255)
    private String deviceId;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "temperature", nullable = false)
    private Double temperature;

    @Column(name = "humidity", nullable = false)
    private Double humidity;

    @Column(name = "battery")
    private Double battery;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw")
    private Map<String, Object> raw;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public SensorReadingEntity(String deviceId, Instant timestamp, Double temperature, Double humidity,
                               Double battery, Map<String, Object> raw) {
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.temperature = temperature;
        this.humidity = humidity;
        this.battery = battery;
        this.raw = raw;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
