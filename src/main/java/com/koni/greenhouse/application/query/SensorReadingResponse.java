package com.koni.greenhouse.application.query;

import com.koni.greenhouse.domain.model.SensorReading;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Data Transfer Object representing a stored sensor reading.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SensorReadingResponse {

    private UUID id;
    private String deviceId;
    private Instant timestamp;
    private Double temperature;
    private Double humidity;
    private Double battery;
    private Map<String, Object> raw;
    private Instant createdAt;

    public static SensorReadingResponse from(SensorReading reading) {
        return new SensorReadingResponse(
                reading.getId(),
                reading.getDeviceId(),
                reading.getTimestamp(),
                reading.getTemperature(),
                reading.getHumidity(),
                reading.getBattery(),
                reading.getRaw(),
                reading.getCreatedAt()
        );
    }
}
