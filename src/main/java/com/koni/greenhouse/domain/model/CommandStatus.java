package com.koni.greenhouse.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Delivery state of a device command.
 * A command starts {@link #QUEUED} and moves exactly once to either
 * {@link #PUBLISHED} or {@link #ERROR}.
 */
public enum CommandStatus {

    QUEUED("queued"),
    PUBLISHED("published"),
    ERROR("error");

    private final String value;

    CommandStatus(String value) {
        this.value = value;
    }

    /**
     * The lower-case form used on the wire and in the database.
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != QUEUED;
    }

    public static CommandStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown command status: " + value));
    }
}
