package com.koni.greenhouse.domain.exception;

/**
 * Exception thrown when the MQTT broker cannot be reached or rejects a publish or subscribe.
 */
public class MessagingFailureException extends RuntimeException {

    public MessagingFailureException(String message) {
        super(message);
    }

    public MessagingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
