package com.koni.greenhouse.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.greenhouse.infrastructure.web.validation.IsoTimestamp;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Data Transfer Object for a sensor reading submitted by a device.
 *
 * Contains:
 * - device_id: identifier of the reporting device
 * - timestamp: when the measurement was taken (ISO 8601)
 * - temperature, humidity: the measured values
 * - battery: battery level, optional
 * - raw: free-form device payload, optional
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SensorDataRequest {

    @JsonProperty("device_id")
    @NotBlank(message = "device_id is required")
    @Size(max = 255, message = "device_id must be at most 255 characters")
    private String deviceId;

    @NotBlank(message = "timestamp must be a valid ISO8601 format")
    @IsoTimestamp(message = "timestamp must be a valid ISO8601 format")
    private String timestamp;

    @NotNull(message = "temperature is required")
    private Double temperature;

    @NotNull(message = "humidity is required")
    @PositiveOrZero(message = "humidity must be a positive number")
    private Double humidity;

    private Double battery;

    private Map<String, Object> raw;
}
