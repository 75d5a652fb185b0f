package com.koni.greenhouse.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A command sent to a greenhouse device and the outcome of handing it to the broker.
 * This is a mutable entity whose status may only move forward, from
 * {@link CommandStatus#QUEUED} to one terminal status.
 */
@Getter
public class DeviceCommand {

    private final UUID id;
    private final String deviceId;
    private final CommandType command;
    private CommandStatus status;
    private String errorMessage;
    private final Instant createdAt;

    public DeviceCommand(UUID id, String deviceId, CommandType command, CommandStatus status,
                         String errorMessage, Instant createdAt) {
        this.id = id;
        this.deviceId = deviceId;
        this.command = command;
        this.status = status;
        this.errorMessage = errorMessage;
        this.createdAt = createdAt;
    }

    /**
     * Creates a new command in the {@link CommandStatus#QUEUED} state.
     *
     * @param deviceId the target device
     * @param command the command to send
     * @return an unsaved queued command
     */
    public static DeviceCommand queue(String deviceId, CommandType command) {
        return new DeviceCommand(null, deviceId, command, CommandStatus.QUEUED, null, null);
    }

    /**
     * Records that the broker accepted the command.
     *
     * @throws IllegalStateException if the command already has a terminal status
     */
    public void markPublished() {
        requireQueued(CommandStatus.PUBLISHED);
        this.status = CommandStatus.PUBLISHED;
    }

    /**
     * Records that handing the command to the broker failed.
     *
     * @param errorMessage description of the failure
     * @throws IllegalStateException if the command already has a terminal status
     */
    public void markFailed(String errorMessage) {
        requireQueued(CommandStatus.ERROR);
        this.status = CommandStatus.ERROR;
        this.errorMessage = errorMessage;
    }

    private void requireQueued(CommandStatus target) {
        if (status != CommandStatus.QUEUED) {
            throw new IllegalStateException(
                    "Command " + id + " cannot move from " + status.getValue() + " to " + target.getValue());
        }
    }

    @Override
    public String toString() {
        return "DeviceCommand{" +
                "id=" + id +
                ", deviceId='" + deviceId + '\'' +
                ", command=" + command +
                ", status=" + status +
                ", errorMessage='" + errorMessage + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
