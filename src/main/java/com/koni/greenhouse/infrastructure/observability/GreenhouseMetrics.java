package com.koni.greenhouse.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking sensor ingestion and device command metrics.
 * Provides counters and timers for monitoring system behavior.
 */
@Slf4j
@Component
public class GreenhouseMetrics {

    private final Counter readingsReceived;
    private final Counter readingsCreated;
    private final Counter duplicateReadings;
    private final Counter commandsPublished;
    private final Counter commandsFailed;
    private final Timer ingestionTime;
    private final Timer commandTime;

    public GreenhouseMetrics(MeterRegistry registry) {
        this.readingsReceived = Counter.builder("sensor.readings.received.total")
                .description("Total sensor readings received")
                .register(registry);

        this.readingsCreated = Counter.builder("sensor.readings.created.total")
                .description("Total sensor readings stored as new records")
                .register(registry);

        this.duplicateReadings = Counter.builder("sensor.readings.duplicates.total")
                .description("Total repeated submissions answered with an existing reading")
                .register(registry);

        this.commandsPublished = Counter.builder("device.commands.total")
                .description("Total device commands by final status")
                .tag("status", "published")
                .register(registry);

        this.commandsFailed = Counter.builder("device.commands.total")
                .description("Total device commands by final status")
                .tag("status", "error")
                .register(registry);

        this.ingestionTime = Timer.builder("sensor.ingestion.time")
                .description("Time to ingest a sensor reading")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.commandTime = Timer.builder("device.command.time")
                .description("Time to store and publish a device command")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordReadingReceived() {
        readingsReceived.increment();
        log.debug("Sensor reading received counter incremented");
    }

    public void recordReadingCreated() {
        readingsCreated.increment();
        log.debug("Sensor reading created counter incremented");
    }

    public void recordDuplicate() {
        duplicateReadings.increment();
        log.debug("Duplicate sensor reading counter incremented");
    }

    public void recordCommandPublished() {
        commandsPublished.increment();
        log.debug("Published command counter incremented");
    }

    public void recordCommandFailed() {
        commandsFailed.increment();
        log.debug("Failed command counter incremented");
    }

    /**
     * Record the time taken to ingest a sensor reading.
     *
     * @param operation the ingestion to time
     * @param <T> the return type of the operation
     * @return the result of the operation
     */
    public <T> T recordIngestionTime(Supplier<T> operation) {
        return ingestionTime.record(operation);
    }

    /**
     * Record the time taken to store and publish a device command.
     *
     * @param operation the command flow to time
     * @param <T> the return type of the operation
     * @return the result of the operation
     */
    public <T> T recordCommandTime(Supplier<T> operation) {
        return commandTime.record(operation);
    }
}
