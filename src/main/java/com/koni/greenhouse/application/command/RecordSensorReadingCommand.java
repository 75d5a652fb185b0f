package com.koni.greenhouse.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Command to record a sensor reading reported by a device.
 * The timestamp is kept in its reported text form and parsed by the handler.
 */
@Getter
@AllArgsConstructor
public class RecordSensorReadingCommand {

    private final String deviceId;

    /**
     * ISO-8601 date-time at which the measurement was taken.
     */
    private final String timestamp;

    private final Double temperature;

    private final Double humidity;

    /**
     * Battery level, optional.
     */
    private final Double battery;

    /**
     * Free-form device payload, optional.
     */
    private final Map<String, Object> raw;

    public RecordSensorReadingCommand(String deviceId, String timestamp, Double temperature,
                                      Double humidity, Double battery) {
        this(deviceId, timestamp, temperature, humidity, battery, null);
    }
}
