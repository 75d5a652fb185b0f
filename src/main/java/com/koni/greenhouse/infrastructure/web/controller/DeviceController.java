package com.koni.greenhouse.infrastructure.web.controller;

import com.koni.greenhouse.application.command.SendDeviceCommand;
import com.koni.greenhouse.application.command.SendDeviceCommandHandler;
import com.koni.greenhouse.application.query.DeviceCommandResponse;
import com.koni.greenhouse.application.query.GetDeviceCommandsQuery;
import com.koni.greenhouse.application.query.GetDeviceCommandsQueryHandler;
import com.koni.greenhouse.domain.model.CommandType;
import com.koni.greenhouse.domain.model.DeviceCommand;
import com.koni.greenhouse.infrastructure.web.dto.DeviceControlRequest;
import com.koni.greenhouse.infrastructure.web.dto.DeviceControlResponse;
import com.koni.greenhouse.infrastructure.web.dto.ListResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for device commands.
 *
 * Endpoints:
 * - POST /api/devices/device-control: Send ON/OFF to a device
 * - GET /api/devices/{deviceId}/commands: Command history of a device
 */
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {

    private final SendDeviceCommandHandler commandHandler;
    private final GetDeviceCommandsQueryHandler queryHandler;

    /**
     * Stores the command and publishes it to {@code <namespace>/control/<device_id>}, where the namespace is
     * {@code greenhouse.mqtt.topic-namespace} (default {@code greenhouse}).
     * A failed publish is answered by the exception handler with 500 and {@code status: "error"}.
     *
     * @return 201 Created with the published command
     */
    @PostMapping("/device-control")
    public ResponseEntity<DeviceControlResponse> sendCommand(@RequestBody @Valid DeviceControlRequest request) {
        log.info("Received device command: deviceId={}, command={}", request.getDeviceId(), request.getCommand());

        DeviceCommand command = commandHandler.handle(
                new SendDeviceCommand(request.getDeviceId(), CommandType.valueOf(request.getCommand())));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new DeviceControlResponse(true, "Command sent successfully",
                        command.getStatus(), DeviceCommandResponse.from(command)));
    }

    @GetMapping("/{deviceId}/commands")
    public ResponseEntity<ListResponse<DeviceCommandResponse>> getCommands(
            @PathVariable String deviceId,
            @RequestParam(required = false) Integer limit) {
        List<DeviceCommandResponse> commands = queryHandler.handle(new GetDeviceCommandsQuery(deviceId, limit));
        return ResponseEntity.ok(new ListResponse<>(commands));
    }
}
