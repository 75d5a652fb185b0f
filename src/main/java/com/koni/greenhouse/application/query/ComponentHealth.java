package com.koni.greenhouse.application.query;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of probing one dependency.
 * Latency is only measured for probes that perform a round-trip and is {@code null} otherwise.
 */
@Getter
@AllArgsConstructor
public class ComponentHealth {

    public enum Status {
        CONNECTED("connected"),
        DISCONNECTED("disconnected");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private final Status status;
    private final Long latencyMs;
    private final String error;

    public static ComponentHealth connected(Long latencyMs) {
        return new ComponentHealth(Status.CONNECTED, latencyMs, null);
    }

    public static ComponentHealth disconnected(Long latencyMs, String error) {
        return new ComponentHealth(Status.DISCONNECTED, latencyMs, error);
    }

    public boolean isConnected() {
        return status == Status.CONNECTED;
    }
}
