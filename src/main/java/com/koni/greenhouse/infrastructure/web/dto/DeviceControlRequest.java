package com.koni.greenhouse.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object for a device control request: {@code {"device_id": "...", "command": "ON"}}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceControlRequest {

    @JsonProperty("device_id")
    @NotBlank(message = "device_id is required")
    private String deviceId;

    @NotNull(message = "command must be either 'ON' or 'OFF'")
    @Pattern(regexp = "ON|OFF", message = "command must be either 'ON' or 'OFF'")
    private String command;
}
