package com.koni.greenhouse.application.service;

import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for publishing arbitrary messages and subscribing to arbitrary topics
 * on the shared MQTT connection. Used by operators for diagnostics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrokerMessagingService {

    private final MessagingGateway messagingGateway;

    /**
     * Publishes a message to a topic.
     *
     * @param topic the topic, required
     * @param message the payload, required
     * @throws ValidationException if topic or message is missing
     * @throws com.koni.greenhouse.domain.exception.MessagingFailureException if the publish fails
     */
    public void publish(String topic, String message) {
        List<FieldViolation> violations = new ArrayList<>();
        if (isBlank(topic)) {
            violations.add(new FieldViolation("topic", "topic is required"));
        }
        if (isBlank(message)) {
            violations.add(new FieldViolation("message", "message is required"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        messagingGateway.publish(topic, message);
        log.info("Published operator message: topic={}, bytes={}", topic, message.length());
    }

    /**
     * Subscribes to a topic filter; received messages are logged.
     *
     * @param topic the topic filter, required
     * @throws ValidationException if topic is missing
     * @throws com.koni.greenhouse.domain.exception.MessagingFailureException if the subscription fails
     */
    public void subscribe(String topic) {
        if (isBlank(topic)) {
            throw new ValidationException("topic", "topic is required");
        }

        messagingGateway.subscribe(topic);
        log.info("Subscribed to topic: {}", topic);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
