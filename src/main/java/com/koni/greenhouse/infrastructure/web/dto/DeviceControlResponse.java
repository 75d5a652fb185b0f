package com.koni.greenhouse.infrastructure.web.dto;

import com.koni.greenhouse.application.query.DeviceCommandResponse;
import com.koni.greenhouse.domain.model.CommandStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DeviceControlResponse {

    private final boolean success;
    private final String message;
    private final CommandStatus status;
    private final DeviceCommandResponse data;
}
