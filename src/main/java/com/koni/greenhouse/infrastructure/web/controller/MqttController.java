package com.koni.greenhouse.infrastructure.web.controller;

import com.koni.greenhouse.application.service.BrokerMessagingService;
import com.koni.greenhouse.infrastructure.web.dto.MessageResponse;
import com.koni.greenhouse.infrastructure.web.dto.MqttPublishRequest;
import com.koni.greenhouse.infrastructure.web.dto.MqttSubscribeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for raw MQTT access.
 *
 * Endpoints:
 * - POST /api/mqtt/publish: Publish a message to any topic
 * - POST /api/mqtt/subscribe: Subscribe to a topic filter; received messages are logged
 */
@RestController
@RequestMapping("/api/mqtt")
@RequiredArgsConstructor
public class MqttController {

    private final BrokerMessagingService messagingService;

    @PostMapping("/publish")
    public ResponseEntity<MessageResponse> publish(@RequestBody @Valid MqttPublishRequest request) {
        messagingService.publish(request.getTopic(), request.getMessage());
        return ResponseEntity.ok(new MessageResponse(true, "Message published to topic: " + request.getTopic()));
    }

    @PostMapping("/subscribe")
    public ResponseEntity<MessageResponse> subscribe(@RequestBody @Valid MqttSubscribeRequest request) {
        messagingService.subscribe(request.getTopic());
        return ResponseEntity.ok(new MessageResponse(true, "Subscribed to topic: " + request.getTopic()));
    }
}
