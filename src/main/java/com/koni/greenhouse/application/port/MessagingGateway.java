package com.koni.greenhouse.application.port;

/**
 * Port interface for the MQTT broker connection.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * that is implemented by an infrastructure adapter holding the single shared client.
 *
 * The application layer depends on this abstraction, not on a concrete MQTT client.
 */
public interface MessagingGateway {

    /**
     * Publishes a message and waits for the broker to acknowledge it.
     *
     * @param topic the topic to publish to
     * @param payload the message body, sent as UTF-8
     * @throws IllegalArgumentException if topic or payload is null
     * @throws com.koni.greenhouse.domain.exception.MessagingFailureException if the broker is not
     *         reachable or rejects the message
     */
    void publish(String topic, String payload);

    /**
     * Subscribes to a topic filter. Messages received on it are logged.
     *
     * @param topic the topic filter
     * @throws com.koni.greenhouse.domain.exception.MessagingFailureException if the broker is not
     *         reachable or rejects the subscription
     */
    void subscribe(String topic);

    /**
     * Reports the current connection state without contacting the broker.
     *
     * @return true if the client is currently connected
     */
    boolean isConnected();
}
