package com.koni.greenhouse.infrastructure.observability;

import com.koni.greenhouse.application.port.MessagingGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the MQTT broker connection.
 * Reads the client state; no round-trip to the broker.
 */
@Component("mqtt")
@RequiredArgsConstructor
public class MqttHealthIndicator implements HealthIndicator {

    private final MessagingGateway messagingGateway;

    @Override
    public Health health() {
        if (messagingGateway.isConnected()) {
            return Health.up().build();
        }
        return Health.down()
                .withDetail("error", "MQTT client disconnected")
                .build();
    }
}
