package com.koni.greenhouse.infrastructure.messaging;

import com.hivemq.client.mqtt.MqttClientState;
import com.hivemq.client.mqtt.datatypes.MqttQos;
import com.hivemq.client.mqtt.mqtt5.Mqtt5AsyncClient;
import com.hivemq.client.mqtt.mqtt5.message.connect.Mqtt5Connect;
import com.hivemq.client.mqtt.mqtt5.message.publish.Mqtt5Publish;
import com.hivemq.client.mqtt.mqtt5.message.publish.Mqtt5PublishResult;
import com.hivemq.client.mqtt.mqtt5.message.subscribe.Mqtt5Subscribe;
import com.hivemq.client.mqtt.mqtt5.message.subscribe.suback.Mqtt5SubAck;
import com.hivemq.client.mqtt.mqtt5.message.subscribe.suback.Mqtt5SubAckReasonCode;
import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.domain.exception.MessagingFailureException;
import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.infrastructure.tracing.TraceUserProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.tracing.annotation.ContinueSpan;
import io.micrometer.tracing.annotation.SpanTag;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * HiveMQ implementation of the MessagingGateway port.
 * Holds the single MQTT connection of the process.
 *
 * Connection handling:
 * - A connected client is used as is
 * - Concurrent callers share one in-flight connect attempt, bounded by the connect timeout
 * - A new connect is only started from the fully disconnected state
 * - While the client library is reconnecting, callers fail fast
 *
 * Publishes go through the "mqtt" circuit breaker and carry the current trace context
 * as MQTT 5 user properties.
 */
@Slf4j
@Component
public class HiveMqMessagingGateway implements MessagingGateway {

    private final Mqtt5AsyncClient client;
    private final Mqtt5Connect connectMessage;
    private final CircuitBreaker circuitBreaker;
    private final TraceUserProperties traceUserProperties;
    private final Duration connectTimeout;
    private final Duration operationTimeout;

    private final ReentrantLock connectLock = new ReentrantLock();
    private CompletableFuture<?> pendingConnect;

    public HiveMqMessagingGateway(
            Mqtt5AsyncClient mqttClient,
            Mqtt5Connect mqttConnect,
            CircuitBreaker mqttCircuitBreaker,
            TraceUserProperties traceUserProperties,
            @Value("${greenhouse.mqtt.connect-timeout:4s}") Duration connectTimeout,
            @Value("${greenhouse.mqtt.operation-timeout:5s}") Duration operationTimeout) {
        this.client = mqttClient;
        this.connectMessage = mqttConnect;
        this.circuitBreaker = mqttCircuitBreaker;
        this.traceUserProperties = traceUserProperties;
        this.connectTimeout = connectTimeout;
        this.operationTimeout = operationTimeout;
    }

    /**
     * Opens the connection once the application is ready to serve.
     * A broker that is down at startup is logged; requests then retry the connection.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void connectOnStartup() {
        try {
            ensureConnected();
        } catch (MessagingFailureException e) {
            log.warn("MQTT broker not reachable at startup: {}", e.getMessage());
        }
    }

    @Override
    @ContinueSpan(log = "mqtt-publish")
    public void publish(@SpanTag("topic") String topic, String payload) {
        if (topic == null || payload == null) {
            throw new IllegalArgumentException("Topic and payload cannot be null");
        }

        Mqtt5Publish message = buildPublish(topic, payload);
        try {
            circuitBreaker.executeRunnable(() -> {
                ensureConnected();
                Mqtt5PublishResult result = await(client.publish(message), operationTimeout, "Publish to " + topic);
                result.getError().ifPresent(error -> {
                    throw new MessagingFailureException(
                            "Publish to " + topic + " failed: " + describe(error), error);
                });
            });
        } catch (CallNotPermittedException e) {
            throw new MessagingFailureException("MQTT publish rejected: circuit breaker is open", e);
        }

        log.debug("Published MQTT message: topic={}, bytes={}", topic, payload.length());
    }

    @Override
    @ContinueSpan(log = "mqtt-subscribe")
    public void subscribe(@SpanTag("topic") String topic) {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        Mqtt5Subscribe subscription = buildSubscribe(topic);
        ensureConnected();
        Mqtt5SubAck subAck = await(client.subscribe(subscription, this::onMessage),
                operationTimeout, "Subscribe to " + topic);

        List<Mqtt5SubAckReasonCode> rejected = subAck.getReasonCodes().stream()
                .filter(Mqtt5SubAckReasonCode::isError)
                .collect(Collectors.toList());
        if (!rejected.isEmpty()) {
            throw new MessagingFailureException("Subscribe to " + topic + " rejected by broker: " + rejected);
        }
    }

    @Override
    public boolean isConnected() {
        return client.getState() == MqttClientState.CONNECTED;
    }

    @PreDestroy
    public void disconnect() {
        if (!client.getState().isConnectedOrReconnect()) {
            return;
        }
        try {
            client.disconnect().get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("MQTT client disconnected on shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disconnecting MQTT client");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("MQTT client did not disconnect cleanly: {}", describe(e));
        }
    }

    /**
     * Makes sure the client is connected before a broker operation.
     *
     * @throws MessagingFailureException if the client is reconnecting, or the connect attempt
     *         fails or does not complete within the connect timeout
     */
    void ensureConnected() {
        CompletableFuture<?> connecting;
        connectLock.lock();
        try {
            MqttClientState state = client.getState();
            if (state == MqttClientState.CONNECTED) {
                return;
            }
            if (pendingConnect != null && !pendingConnect.isDone()) {
                connecting = pendingConnect;
            } else if (state == MqttClientState.DISCONNECTED) {
                log.info("Connecting to MQTT broker");
                pendingConnect = client.connect(connectMessage);
                connecting = pendingConnect;
            } else {
                throw new MessagingFailureException("MQTT client is reconnecting (state " + state + ")");
            }
        } finally {
            connectLock.unlock();
        }

        await(connecting, connectTimeout, "Connecting to MQTT broker");
    }

    private Mqtt5Publish buildPublish(String topic, String payload) {
        try {
            return Mqtt5Publish.builder()
                    .topic(topic)
                    .qos(MqttQos.AT_LEAST_ONCE)
                    .payload(payload.getBytes(StandardCharsets.UTF_8))
                    .userProperties(traceUserProperties.current())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("topic", "topic is not a valid MQTT topic: " + e.getMessage());
        }
    }

    private Mqtt5Subscribe buildSubscribe(String topic) {
        try {
            return Mqtt5Subscribe.builder()
                    .topicFilter(topic)
                    .qos(MqttQos.AT_LEAST_ONCE)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("topic", "topic is not a valid MQTT topic filter: " + e.getMessage());
        }
    }

    private void onMessage(Mqtt5Publish message) {
        log.info("Received MQTT message: topic={}, payload={}",
                message.getTopic(), new String(message.getPayloadAsBytes(), StandardCharsets.UTF_8));
    }

    private static <T> T await(CompletableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new MessagingFailureException(operation + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new MessagingFailureException(operation + " failed: " + describe(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingFailureException(operation + " interrupted", e);
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
