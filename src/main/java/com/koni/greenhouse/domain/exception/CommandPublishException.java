package com.koni.greenhouse.domain.exception;

import com.koni.greenhouse.domain.model.DeviceCommand;

/**
 * Exception thrown when a device command was stored but could not be published.
 * The command has already been recorded with status {@code error}.
 */
public class CommandPublishException extends MessagingFailureException {

    private final transient DeviceCommand command;

    public CommandPublishException(DeviceCommand command, Throwable cause) {
        super(command.getErrorMessage(), cause);
        this.command = command;
    }

    public DeviceCommand getCommand() {
        return command;
    }
}
