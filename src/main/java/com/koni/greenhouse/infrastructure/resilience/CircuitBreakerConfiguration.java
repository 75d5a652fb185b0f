package com.koni.greenhouse.infrastructure.resilience;

import com.koni.greenhouse.domain.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the circuit breaker guarding the MQTT broker.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, publishes reach the broker
 * - OPEN: Failure threshold exceeded, publishes fail fast
 * - HALF_OPEN: Testing if the broker recovered, limited publishes allowed
 */
@Slf4j
@Configuration
public class CircuitBreakerConfiguration {

    public static final String MQTT = "mqtt";

    /**
     * Configuration:
     * - Sliding window: 10 calls (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 10 seconds
     * - Permitted calls in HALF_OPEN: 3
     */
    @Bean
    public CircuitBreakerConfig mqttCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(10))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .ignoreExceptions(ValidationException.class, IllegalArgumentException.class)
            .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Creates the "mqtt" circuit breaker and logs its state transitions.
     */
    @Bean
    public CircuitBreaker mqttCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(MQTT);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Circuit breaker '{}' state transition: {} -> {} (failure rate: {}%)",
                        event.getCircuitBreakerName(),
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onCallNotPermitted(event -> log.warn("Circuit breaker '{}' call not permitted (circuit is OPEN)",
                        event.getCircuitBreakerName()));
        return circuitBreaker;
    }
}
