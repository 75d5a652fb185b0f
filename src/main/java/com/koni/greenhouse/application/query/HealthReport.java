package com.koni.greenhouse.application.query;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Composite health of the service: "ok" only when both the database and the broker are connected.
 */
@Getter
public class HealthReport {

    public enum Overall {
        OK("ok"),
        DEGRADED("degraded");

        private final String value;

        Overall(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private final Overall overall;
    private final ComponentHealth database;
    private final ComponentHealth broker;

    public HealthReport(ComponentHealth database, ComponentHealth broker) {
        this.database = database;
        this.broker = broker;
        this.overall = database.isConnected() && broker.isConnected() ? Overall.OK : Overall.DEGRADED;
    }

    public boolean isHealthy() {
        return overall == Overall.OK;
    }
}
