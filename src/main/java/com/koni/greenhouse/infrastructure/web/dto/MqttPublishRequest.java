package com.koni.greenhouse.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MqttPublishRequest {

    @NotBlank(message = "topic is required")
    private String topic;

    @NotBlank(message = "message is required")
    private String message;
}
