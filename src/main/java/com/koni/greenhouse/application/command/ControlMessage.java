package com.koni.greenhouse.application.command;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Payload published to a device's control topic.
 * Serialized as {@code {"command":"ON","timestamp":"2025-12-26T20:00:00Z"}}.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ControlMessage {

    private final String command;
    private final String timestamp;

    @JsonCreator
    public ControlMessage(
            @JsonProperty("command") String command,
            @JsonProperty("timestamp") String timestamp) {
        this.command = command;
        this.timestamp = timestamp;
    }
}
