package com.koni.greenhouse.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.greenhouse.application.query.ComponentHealth;
import com.koni.greenhouse.application.query.HealthReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Wire shape of the health check:
 * {@code {"service": "ok", "db": {"status", "latency_ms", "error"?}, "mqtt": {"status", "error"?}}}.
 */
@Getter
@AllArgsConstructor
public class HealthStatusResponse {

    private final HealthReport.Overall service;
    private final DatabaseStatus db;
    private final BrokerStatus mqtt;

    public static HealthStatusResponse from(HealthReport report) {
        ComponentHealth database = report.getDatabase();
        ComponentHealth broker = report.getBroker();
        return new HealthStatusResponse(
                report.getOverall(),
                new DatabaseStatus(database.getStatus(), database.getLatencyMs(), database.getError()),
                new BrokerStatus(broker.getStatus(), broker.getError())
        );
    }

    @Getter
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DatabaseStatus {

        private final ComponentHealth.Status status;

        @JsonProperty("latency_ms")
        private final Long latencyMs;

        private final String error;
    }

    @Getter
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BrokerStatus {

        private final ComponentHealth.Status status;
        private final String error;
    }
}
