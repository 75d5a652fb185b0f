package com.koni.greenhouse.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.domain.exception.CommandPublishException;
import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.domain.model.DeviceCommand;
import com.koni.greenhouse.domain.repository.DeviceCommandRepository;
import com.koni.greenhouse.infrastructure.observability.GreenhouseMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Command handler for sending control commands to greenhouse devices.
 *
 * Responsibilities:
 * - Store the command with status "queued"
 * - Publish {"command", "timestamp"} to {@code <namespace>/control/<deviceId>}
 * - Record the outcome as "published" or "error"
 *
 * Commands are not idempotent: every call stores a new command. A failed publish is
 * not retried.
 */
@Slf4j
@Service
public class SendDeviceCommandHandler {

    private final DeviceCommandRepository deviceCommandRepository;
    private final MessagingGateway messagingGateway;
    private final ObjectMapper objectMapper;
    private final GreenhouseMetrics metrics;
    private final String topicNamespace;

    public SendDeviceCommandHandler(
            DeviceCommandRepository deviceCommandRepository,
            MessagingGateway messagingGateway,
            ObjectMapper objectMapper,
            GreenhouseMetrics metrics,
            @Value("${greenhouse.mqtt.topic-namespace:greenhouse}") String topicNamespace) {
        this.deviceCommandRepository = deviceCommandRepository;
        this.messagingGateway = messagingGateway;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topicNamespace = topicNamespace;
    }

    /**
     * Handles the SendDeviceCommand.
     *
     * @param command the device and the command to send
     * @return the stored command with status "published"
     * @throws ValidationException if the device id is blank or the command is missing
     * @throws CommandPublishException if publishing failed; the command is stored with status "error"
     * @throws com.koni.greenhouse.domain.exception.DatabaseUnavailableException if the database cannot be reached
     */
    @Observed(name = "command.handler", contextualName = "send-device-command")
    public DeviceCommand handle(SendDeviceCommand command) {
        validate(command);
        log.debug("Handling SendDeviceCommand: deviceId={}, command={}",
                command.getDeviceId(), command.getCommand());

        return metrics.recordCommandTime(() -> {
            DeviceCommand queued = deviceCommandRepository.save(
                    DeviceCommand.queue(command.getDeviceId(), command.getCommand()));
            log.info("Device command queued: id={}, deviceId={}, command={}",
                    queued.getId(), queued.getDeviceId(), queued.getCommand());

            String topic = controlTopic(queued.getDeviceId());
            String payload = serialize(new ControlMessage(queued.getCommand().name(), Instant.now().toString()));

            try {
                messagingGateway.publish(topic, payload);
            } catch (RuntimeException e) {
                queued.markFailed(describe(e));
                DeviceCommand failed = deviceCommandRepository.save(queued);
                metrics.recordCommandFailed();
                log.warn("Device command could not be published: id={}, topic={}, error={}",
                        failed.getId(), topic, failed.getErrorMessage());
                throw new CommandPublishException(failed, e);
            }

            queued.markPublished();
            DeviceCommand published = deviceCommandRepository.save(queued);
            metrics.recordCommandPublished();
            log.info("Device command published: id={}, topic={}", published.getId(), topic);
            return published;
        });
    }

    /**
     * Topic a device listens on for control messages.
     */
    public String controlTopic(String deviceId) {
        return topicNamespace + "/control/" + deviceId;
    }

    private void validate(SendDeviceCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (command.getDeviceId() == null || command.getDeviceId().isBlank()) {
            violations.add(new FieldViolation("device_id", "device_id is required"));
        }
        if (command.getCommand() == null) {
            violations.add(new FieldViolation("command", "command must be either 'ON' or 'OFF'"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private String serialize(ControlMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Control message cannot be serialized", e);
        }
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
