package com.koni.greenhouse.application.query;

import com.koni.greenhouse.domain.exception.FieldViolation;
import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.domain.model.SensorReading;
import com.koni.greenhouse.domain.repository.SensorReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GetSensorReadingsQueryHandlerTest {

    @Mock
    private SensorReadingRepository repository;

    private GetSensorReadingsQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GetSensorReadingsQueryHandler(repository, 100);
    }

    @Test
    void shouldListAllReadingsWithDefaultLimit() {
        SensorReading reading = new SensorReading(UUID.randomUUID(), "sensor-001",
                Instant.parse("2025-12-26T20:00:00Z"), 25.5, 60.0, 85.0, null, Instant.now());
        when(repository.find(null, null, null, 100)).thenReturn(List.of(reading));

        List<SensorReadingResponse> result = handler.handle(new GetSensorReadingsQuery(null, null, null, null));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getId()).isEqualTo(reading.getId());
        assertThat(result.get(0).getDeviceId()).isEqualTo("sensor-001");
        assertThat(result.get(0).getTemperature()).isEqualTo(25.5);
    }

    @Test
    void shouldPassFiltersToRepository() {
        when(repository.find(any(), any(), any(), anyInt())).thenReturn(List.of());

        handler.handle(new GetSensorReadingsQuery("sensor-001",
                "2025-12-01T00:00:00Z", "2025-12-31T23:59:59Z", 10));

        verify(repository).find("sensor-001",
                Instant.parse("2025-12-01T00:00:00Z"), Instant.parse("2025-12-31T23:59:59Z"), 10);
    }

    @Test
    void shouldIgnoreEndDateWithoutStartDate() {
        when(repository.find(any(), any(), any(), anyInt())).thenReturn(List.of());

        handler.handle(new GetSensorReadingsQuery(" ", null, "2025-12-31T23:59:59Z", null));

        verify(repository).find(null, null, null, 100);
    }

    @Test
    void shouldRejectInvalidDates() {
        assertThatThrownBy(() -> handler.handle(new GetSensorReadingsQuery(null, "last week", "soon", null)))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getViolations())
                        .extracting(FieldViolation::getField)
                        .containsExactly("startDate", "endDate"));

        verifyNoInteractions(repository);
    }

    @Test
    void shouldRejectLimitOutOfRange() {
        assertThatThrownBy(() -> handler.handle(new GetSensorReadingsQuery(null, null, null, 0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("limit must be between 1 and 1000");
        assertThatThrownBy(() -> handler.handle(new GetSensorReadingsQuery(null, null, null, 1001)))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(repository);
    }
}
