package com.koni.greenhouse.application.command;

import com.koni.greenhouse.domain.model.CommandType;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to switch a greenhouse device on or off.
 */
@Getter
@AllArgsConstructor
public class SendDeviceCommand {

    private final String deviceId;

    private final CommandType command;
}
