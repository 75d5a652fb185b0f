package com.koni.greenhouse.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.greenhouse.domain.exception.FieldViolation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * DTO for error responses returned by the REST API.
 * Every error carries {@code success: false}, a machine-checkable {@code error} code
 * and a human-readable message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final boolean success = false;
    private final String error;
    private final String message;
    private final List<FieldViolation> details;
    private final String status;
    private final UUID commandId;
    private final Instant timestamp;

    public ErrorResponse(String error, String message) {
        this(error, message, null, null, null);
    }

    public ErrorResponse(String error, String message, List<FieldViolation> details,
                         String status, UUID commandId) {
        this.error = error;
        this.message = message;
        this.details = details;
        this.status = status;
        this.commandId = commandId;
        this.timestamp = Instant.now();
    }

    public static ErrorResponse validation(String message, List<FieldViolation> details) {
        return new ErrorResponse("validation_failed", message, details, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public List<FieldViolation> getDetails() {
        return details;
    }

    public String getStatus() {
        return status;
    }

    public UUID getCommandId() {
        return commandId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
