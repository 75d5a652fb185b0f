package com.koni.greenhouse.infrastructure.resilience;

import com.koni.greenhouse.domain.exception.MessagingFailureException;
import com.koni.greenhouse.domain.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CircuitBreakerConfiguration.
 * Verifies the "mqtt" breaker settings and its opening behaviour.
 */
class CircuitBreakerConfigurationTest {

    private final CircuitBreakerConfiguration configuration = new CircuitBreakerConfiguration();

    private CircuitBreakerConfig config;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        config = configuration.mqttCircuitBreakerConfig();
        circuitBreaker = configuration.mqttCircuitBreaker(configuration.circuitBreakerRegistry(config));
    }

    @Test
    void shouldConfigureMqttBreaker() {
        assertThat(circuitBreaker.getName()).isEqualTo(CircuitBreakerConfiguration.MQTT);
        assertThat(config.getSlidingWindowSize()).isEqualTo(10);
        assertThat(config.getFailureRateThreshold()).isEqualTo(50.0f);
        assertThat(config.getPermittedNumberOfCallsInHalfOpenState()).isEqualTo(3);
        assertThat(config.isAutomaticTransitionFromOpenToHalfOpenEnabled()).isTrue();
    }

    @Test
    void shouldOpenAfterRepeatedBrokerFailures() {
        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> circuitBreaker.executeRunnable(() -> {
                throw new MessagingFailureException("Connection refused");
            })).isInstanceOf(MessagingFailureException.class);
        }

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> circuitBreaker.executeRunnable(() -> { }))
                .isInstanceOf(CallNotPermittedException.class);
    }

    @Test
    void shouldNotCountInvalidInputAsBrokerFailure() {
        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> circuitBreaker.executeRunnable(() -> {
                throw new ValidationException("topic", "topic is not a valid MQTT topic");
            })).isInstanceOf(ValidationException.class);
        }

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isZero();
    }
}
