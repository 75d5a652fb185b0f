package com.koni.greenhouse.application.service;

import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.MessagingFailureException;
import com.koni.greenhouse.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BrokerMessagingServiceTest {

    @Mock
    private MessagingGateway messagingGateway;

    @InjectMocks
    private BrokerMessagingService service;

    @Test
    void shouldPublishThroughGateway() {
        service.publish("greenhouse/announcements", "hello");

        verify(messagingGateway).publish("greenhouse/announcements", "hello");
    }

    @Test
    void shouldRejectMissingTopicAndMessage() {
        assertThatThrownBy(() -> service.publish(null, ""))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getViolations()).containsExactly(
                        new FieldViolation("topic", "topic is required"),
                        new FieldViolation("message", "message is required")));

        verifyNoInteractions(messagingGateway);
    }

    @Test
    void shouldPropagateGatewayFailure() {
        doThrow(new MessagingFailureException("Subscribe to a/b rejected by broker"))
                .when(messagingGateway).subscribe("a/b");

        assertThatThrownBy(() -> service.subscribe("a/b"))
                .isInstanceOf(MessagingFailureException.class)
                .hasMessageContaining("rejected");
    }

    @Test
    void shouldRejectBlankSubscribeTopic() {
        assertThatThrownBy(() -> service.subscribe(" "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("topic is required");

        verifyNoInteractions(messagingGateway);
    }
}
