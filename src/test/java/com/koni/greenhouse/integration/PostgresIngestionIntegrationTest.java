package com.koni.greenhouse.integration;

import com.koni.greenhouse.application.command.RecordSensorReadingCommand;
import com.koni.greenhouse.application.command.RecordSensorReadingCommandHandler;
import com.koni.greenhouse.application.command.SensorIngestionResult;
import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.infrastructure.persistence.repository.DeviceCommandJpaRepository;
import com.koni.greenhouse.infrastructure.persistence.repository.SensorReadingJpaRepository;
import com.koni.greenhouse.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests against a real PostgreSQL instance created from schema.sql.
 *
 * Tests:
 * - Concurrent identical submissions produce exactly one row
 * - The raw payload is stored as jsonb
 * - Command status is stored in its lower-case form and accepted by the check constraint
 */
@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PostgresIngestionIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16")
    )
            .withDatabaseName("greenhouse_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RecordSensorReadingCommandHandler commandHandler;

    @Autowired
    private SensorReadingJpaRepository sensorReadingJpaRepository;

    @Autowired
    private DeviceCommandJpaRepository deviceCommandJpaRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private MessagingGateway messagingGateway;

    @BeforeEach
    void setUp() {
        sensorReadingJpaRepository.deleteAll();
        deviceCommandJpaRepository.deleteAll();
    }

    @Test
    void shouldStoreOneRowForConcurrentIdenticalSubmissions() throws Exception {
        // Given
        int submissions = 8;
        ExecutorService executor = Executors.newFixedThreadPool(submissions);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SensorIngestionResult>> results = new ArrayList<>();

        try {
            for (int i = 0; i < submissions; i++) {
                Callable<SensorIngestionResult> submit = () -> {
                    start.await();
                    return commandHandler.handle(new RecordSensorReadingCommand(
                            "sensor-001", "2025-12-26T20:00:00Z", 25.5, 60.0, 85.0, null));
                };
                results.add(executor.submit(submit));
            }

            // When
            start.countDown();

            // Then
            List<SensorIngestionResult> outcomes = new ArrayList<>();
            for (Future<SensorIngestionResult> result : results) {
                outcomes.add(result.get(10, TimeUnit.SECONDS));
            }
            assertThat(outcomes).filteredOn(SensorIngestionResult::isNew).hasSize(1);
            assertThat(outcomes).extracting(outcome -> outcome.getReading().getId()).containsOnly(
                    outcomes.get(0).getReading().getId());
            assertThat(sensorReadingJpaRepository.count()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldStoreRawPayloadAsJson() throws Exception {
        mockMvc.perform(post("/api/sensors/sensor-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"sensor-002\",\"timestamp\":\"2025-12-26T20:00:00+01:00\","
                                + "\"temperature\":19.0,\"humidity\":70,\"raw\":{\"rssi\":-67,\"fw\":\"1.4.2\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.timestamp").value("2025-12-26T19:00:00Z"))
                .andExpect(jsonPath("$.data.raw.fw").value("1.4.2"));

        Map<String, Object> row = jdbcTemplate.queryForMap(
                "select raw ->> 'fw' as fw, jsonb_typeof(raw) as kind from sensor_readings where device_id = ?",
                "sensor-002");
        assertThat(row).containsEntry("fw", "1.4.2").containsEntry("kind", "object");

        mockMvc.perform(get("/api/sensors/sensor-data")
                        .param("deviceId", "sensor-002")
                        .param("startDate", "2025-12-26T18:00:00Z")
                        .param("endDate", "2025-12-26T20:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void shouldPersistCommandStatusAcceptedBySchema() throws Exception {
        mockMvc.perform(post("/api/devices/device-control")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"greenhouse-01\",\"command\":\"ON\"}"))
                .andExpect(status().isCreated());

        String stored = jdbcTemplate.queryForObject(
                "select status from device_commands where device_id = ?", String.class, "greenhouse-01");
        assertThat(stored).isEqualTo("published");
    }
}
