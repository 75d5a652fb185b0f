package com.koni.greenhouse.application.query;

import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.domain.model.CommandStatus;
import com.koni.greenhouse.domain.model.CommandType;
import com.koni.greenhouse.domain.model.DeviceCommand;
import com.koni.greenhouse.domain.repository.DeviceCommandRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GetDeviceCommandsQueryHandlerTest {

    @Mock
    private DeviceCommandRepository repository;

    @InjectMocks
    private GetDeviceCommandsQueryHandler handler;

    @Test
    void shouldReturnHistoryWithDefaultLimit() {
        DeviceCommand failed = new DeviceCommand(UUID.randomUUID(), "greenhouse-01", CommandType.OFF,
                CommandStatus.ERROR, "timeout", Instant.parse("2025-12-26T20:05:00Z"));
        DeviceCommand published = new DeviceCommand(UUID.randomUUID(), "greenhouse-01", CommandType.ON,
                CommandStatus.PUBLISHED, null, Instant.parse("2025-12-26T20:00:00Z"));
        when(repository.findRecentByDeviceId("greenhouse-01", GetDeviceCommandsQueryHandler.DEFAULT_LIMIT))
                .thenReturn(List.of(failed, published));

        List<DeviceCommandResponse> result = handler.handle(new GetDeviceCommandsQuery("greenhouse-01", null));

        assertThat(result).extracting(DeviceCommandResponse::getStatus)
                .containsExactly(CommandStatus.ERROR, CommandStatus.PUBLISHED);
        assertThat(result.get(0).getErrorMessage()).isEqualTo("timeout");
    }

    @Test
    void shouldRejectLimitAboveMaximum() {
        assertThatThrownBy(() -> handler.handle(new GetDeviceCommandsQuery("greenhouse-01", 101)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("limit must be between 1 and 100");

        verifyNoInteractions(repository);
    }
}
