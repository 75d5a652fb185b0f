package com.koni.greenhouse.application.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.greenhouse.domain.model.CommandStatus;
import com.koni.greenhouse.domain.model.CommandType;
import com.koni.greenhouse.domain.model.DeviceCommand;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Data Transfer Object representing a device command and its delivery status.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceCommandResponse {

    private UUID id;
    private String deviceId;
    private CommandType command;
    private CommandStatus status;
    private String errorMessage;
    private Instant createdAt;

    public static DeviceCommandResponse from(DeviceCommand command) {
        return new DeviceCommandResponse(
                command.getId(),
                command.getDeviceId(),
                command.getCommand(),
                command.getStatus(),
                command.getErrorMessage(),
                command.getCreatedAt()
        );
    }
}
