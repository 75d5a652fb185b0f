package com.koni.greenhouse.infrastructure.web.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.koni.greenhouse.domain.exception.CommandPublishException;
import com.koni.greenhouse.domain.exception.DatabaseUnavailableException;
import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.MessagingFailureException;
import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Maps each failure kind to one HTTP status and one error code.
 *
 * | Exception                     | Status | error               |
 * | ValidationException & friends | 400    | validation_failed   |
 * | DatabaseUnavailableException  | 503    | storage_unavailable |
 * | MessagingFailureException     | 500    | messaging_failure   |
 * | anything else                 | 500    | internal_error      |
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.validation(ex.getMessage(), ex.getViolations()));
    }

    /**
     * Handle Bean Validation failures on request bodies.
     * Field names are reported as they appear on the wire (device_id, not deviceId).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        List<FieldViolation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldViolation(toWireName(error.getField()), error.getDefaultMessage()))
                .collect(Collectors.toList());
        String message = violations.stream()
                .map(FieldViolation::getMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation error: {}", message);
        return ResponseEntity.badRequest().body(ErrorResponse.validation(message, violations));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        if (ex.getCause() instanceof JsonMappingException) {
            List<JsonMappingException.Reference> path = ((JsonMappingException) ex.getCause()).getPath();
            String field = path.isEmpty() ? null : path.get(path.size() - 1).getFieldName();
            if (field != null) {
                String message = field + " has an invalid value";
                return ResponseEntity.badRequest()
                        .body(ErrorResponse.validation(message, List.of(new FieldViolation(field, message))));
            }
        }
        return ResponseEntity.badRequest()
                .body(ErrorResponse.validation("Malformed JSON request body", List.of()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = ex.getName() + " has an invalid value";
        log.warn("Request parameter error: {}", message);
        return ResponseEntity.badRequest()
                .body(ErrorResponse.validation(message, List.of(new FieldViolation(ex.getName(), message))));
    }

    @ExceptionHandler(DatabaseUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseUnavailableException(DatabaseUnavailableException ex) {
        log.error("Database unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("storage_unavailable",
                        "Unable to connect to database. Please try again later."));
    }

    /**
     * Handle a device command that was stored but could not be published.
     * The body reports the recorded status and the command identifier.
     */
    @ExceptionHandler(CommandPublishException.class)
    public ResponseEntity<ErrorResponse> handleCommandPublishException(CommandPublishException ex) {
        log.error("Device command publish failed: commandId={}, error={}",
                ex.getCommand().getId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("messaging_failure", ex.getMessage(), null,
                        ex.getCommand().getStatus().getValue(), ex.getCommand().getId()));
    }

    @ExceptionHandler(MessagingFailureException.class)
    public ResponseEntity<ErrorResponse> handleMessagingFailureException(MessagingFailureException ex) {
        log.error("MQTT operation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("messaging_failure", ex.getMessage()));
    }

    /**
     * Handle routing and content negotiation failures raised by Spring MVC itself.
     * Keeps their own status code (404, 405, 415).
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleRequestRejected(Exception ex) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        log.warn("Request rejected: status={}, reason={}", status.value(), ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse("request_rejected", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal_error", "Internal server error"));
    }

    static String toWireName(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
