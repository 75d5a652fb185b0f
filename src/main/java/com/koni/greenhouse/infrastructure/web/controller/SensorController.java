package com.koni.greenhouse.infrastructure.web.controller;

import com.koni.greenhouse.application.command.RecordSensorReadingCommand;
import com.koni.greenhouse.application.command.RecordSensorReadingCommandHandler;
import com.koni.greenhouse.application.command.SensorIngestionResult;
import com.koni.greenhouse.application.query.GetSensorReadingsQuery;
import com.koni.greenhouse.application.query.GetSensorReadingsQueryHandler;
import com.koni.greenhouse.application.query.SensorReadingResponse;
import com.koni.greenhouse.infrastructure.web.dto.ListResponse;
import com.koni.greenhouse.infrastructure.web.dto.SensorDataRequest;
import com.koni.greenhouse.infrastructure.web.dto.SensorDataResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for sensor data.
 *
 * Endpoints:
 * - POST /api/sensors/sensor-data: Record a reading (idempotent per device and timestamp)
 * - GET /api/sensors/sensor-data: List stored readings, newest first
 */
@RestController
@RequestMapping("/api/sensors")
@RequiredArgsConstructor
@Slf4j
public class SensorController {

    private final RecordSensorReadingCommandHandler commandHandler;
    private final GetSensorReadingsQueryHandler queryHandler;

    /**
     * Records a sensor reading.
     *
     * Example request:
     * POST /api/sensors/sensor-data
     * {
     *   "device_id": "sensor-001",
     *   "timestamp": "2025-12-26T20:00:00Z",
     *   "temperature": 25.5,
     *   "humidity": 60,
     *   "battery": 85
     * }
     *
     * @param request the reading to record
     * @return 201 Created for a new reading, 200 OK with the original reading for a repeated submission
     */
    @PostMapping("/sensor-data")
    public ResponseEntity<SensorDataResponse> recordSensorData(@RequestBody @Valid SensorDataRequest request) {
        log.info("Received sensor data: deviceId={}, timestamp={}", request.getDeviceId(), request.getTimestamp());

        RecordSensorReadingCommand command = new RecordSensorReadingCommand(
                request.getDeviceId(),
                request.getTimestamp(),
                request.getTemperature(),
                request.getHumidity(),
                request.getBattery(),
                request.getRaw()
        );

        SensorIngestionResult result = commandHandler.handle(command);
        SensorReadingResponse data = SensorReadingResponse.from(result.getReading());

        if (result.isNew()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new SensorDataResponse(true, "New record created", data.getId(), data));
        }
        return ResponseEntity.ok(new SensorDataResponse(true, "Record already exists", data.getId(), data));
    }

    /**
     * Lists stored readings. All parameters are optional.
     *
     * @param deviceId restrict to one device
     * @param startDate inclusive lower bound (ISO 8601)
     * @param endDate inclusive upper bound (ISO 8601), only applied together with startDate
     * @param limit maximum number of readings, default 100
     */
    @GetMapping("/sensor-data")
    public ResponseEntity<ListResponse<SensorReadingResponse>> getSensorData(
            @RequestParam(required = false) String deviceId,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) Integer limit) {
        log.debug("Listing sensor data: deviceId={}, startDate={}, endDate={}, limit={}",
                deviceId, startDate, endDate, limit);

        List<SensorReadingResponse> readings = queryHandler.handle(
                new GetSensorReadingsQuery(deviceId, startDate, endDate, limit));
        return ResponseEntity.ok(new ListResponse<>(readings));
    }
}
