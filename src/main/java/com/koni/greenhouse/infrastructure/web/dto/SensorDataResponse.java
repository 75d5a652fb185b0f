package com.koni.greenhouse.infrastructure.web.dto;

import com.koni.greenhouse.application.query.SensorReadingResponse;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Response to a sensor reading submission, for both a new and an already stored reading.
 */
@Getter
@AllArgsConstructor
public class SensorDataResponse {

    private final boolean success;
    private final String message;
    private final UUID id;
    private final SensorReadingResponse data;
}
