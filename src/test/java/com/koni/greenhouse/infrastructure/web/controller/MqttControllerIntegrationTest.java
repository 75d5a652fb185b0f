package com.koni.greenhouse.infrastructure.web.controller;

import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.domain.exception.MessagingFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the raw MQTT publish and subscribe routes.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MqttControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MessagingGateway messagingGateway;

    @Test
    void shouldPublishToAnyTopic() throws Exception {
        mockMvc.perform(post("/api/mqtt/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"greenhouse/announce\",\"message\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Message published to topic: greenhouse/announce"));

        verify(messagingGateway).publish("greenhouse/announce", "hello");
    }

    @Test
    void shouldRejectPublishWithoutTopic() throws Exception {
        mockMvc.perform(post("/api/mqtt/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("topic"));

        verify(messagingGateway, never()).publish(anyString(), anyString());
    }

    @Test
    void shouldReportBrokerFailure() throws Exception {
        doThrow(new MessagingFailureException("MQTT publish rejected: circuit breaker is open"))
                .when(messagingGateway).publish(anyString(), anyString());

        mockMvc.perform(post("/api/mqtt/publish")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"greenhouse/announce\",\"message\":\"hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("messaging_failure"))
                .andExpect(jsonPath("$.message").value("MQTT publish rejected: circuit breaker is open"));
    }

    @Test
    void shouldSubscribeToTopicFilter() throws Exception {
        mockMvc.perform(post("/api/mqtt/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"greenhouse/sensors/#\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Subscribed to topic: greenhouse/sensors/#"));

        verify(messagingGateway).subscribe("greenhouse/sensors/#");
    }
}
