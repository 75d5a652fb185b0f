package com.koni.greenhouse.infrastructure.messaging;

import com.hivemq.client.mqtt.mqtt5.Mqtt5AsyncClient;
import com.hivemq.client.mqtt.mqtt5.Mqtt5Client;
import com.hivemq.client.mqtt.mqtt5.message.auth.Mqtt5SimpleAuth;
import com.hivemq.client.mqtt.mqtt5.message.connect.Mqtt5Connect;
import com.hivemq.client.mqtt.mqtt5.message.connect.Mqtt5ConnectBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the MQTT 5 client shared by the whole process.
 *
 * The client is only built here; {@link HiveMqMessagingGateway} owns the connection.
 * Lost connections are re-established by the client library with a fixed delay.
 */
@Slf4j
@Configuration
public class MqttClientConfiguration {

    @Value("${greenhouse.mqtt.host:localhost}")
    private String host;

    @Value("${greenhouse.mqtt.port:1883}")
    private int port;

    @Value("${greenhouse.mqtt.client-id:greenhouse-backend}")
    private String clientId;

    @Value("${greenhouse.mqtt.username:}")
    private String username;

    @Value("${greenhouse.mqtt.password:}")
    private String password;

    @Value("${greenhouse.mqtt.reconnect-delay:5s}")
    private Duration reconnectDelay;

    @Value("${greenhouse.mqtt.keep-alive:30s}")
    private Duration keepAlive;

    @Bean
    public Mqtt5AsyncClient mqttClient() {
        String identifier = clientId + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Creating MQTT client: identifier={}, broker={}:{}", identifier, host, port);

        return Mqtt5Client.builder()
                .identifier(identifier)
                .serverHost(host)
                .serverPort(port)
                .automaticReconnect()
                    .initialDelay(reconnectDelay.toMillis(), TimeUnit.MILLISECONDS)
                    .maxDelay(reconnectDelay.toMillis(), TimeUnit.MILLISECONDS)
                    .applyAutomaticReconnect()
                .addConnectedListener(context -> log.info("MQTT client connected: broker={}:{}", host, port))
                .addDisconnectedListener(context -> log.warn("MQTT client disconnected: broker={}:{}, cause={}",
                        host, port, context.getCause().getMessage()))
                .buildAsync();
    }

    /**
     * The CONNECT packet sent on every connection attempt made by the gateway.
     */
    @Bean
    public Mqtt5Connect mqttConnect() {
        Mqtt5ConnectBuilder builder = Mqtt5Connect.builder()
                .cleanStart(true)
                .keepAlive((int) keepAlive.toSeconds());
        if (!username.isBlank()) {
            builder.simpleAuth(Mqtt5SimpleAuth.builder()
                    .username(username)
                    .password(password.getBytes(StandardCharsets.UTF_8))
                    .build());
        }
        return builder.build();
    }
}
