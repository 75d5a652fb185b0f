package com.koni.greenhouse.application.query;

import com.koni.greenhouse.application.port.MessagingGateway;
import com.koni.greenhouse.application.port.StorageHealthProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Query handler that probes the database and the MQTT broker.
 *
 * The database probe runs on the probe executor, bounded by a timeout that starts
 * when the check starts, so a queued probe counts against it. The broker probe only
 * reads the client state and runs on the calling thread while the database probe is
 * in flight. A failing probe is reported as "disconnected" and never prevents the
 * other probe from being reported.
 */
@Slf4j
@Service
public class CheckHealthQueryHandler {

    private final StorageHealthProbe storageHealthProbe;
    private final MessagingGateway messagingGateway;
    private final Executor executor;
    private final Duration databaseTimeout;

    public CheckHealthQueryHandler(
            StorageHealthProbe storageHealthProbe,
            MessagingGateway messagingGateway,
            @Qualifier("healthProbeExecutor") Executor executor,
            @Value("${greenhouse.health.db-timeout:2s}") Duration databaseTimeout) {
        this.storageHealthProbe = storageHealthProbe;
        this.messagingGateway = messagingGateway;
        this.executor = executor;
        this.databaseTimeout = databaseTimeout;
    }

    /**
     * Handles the CheckHealthQuery.
     *
     * @param query the query object (contains no parameters)
     * @return the composite health; never throws for a failing dependency
     */
    public HealthReport handle(CheckHealthQuery query) {
        CompletableFuture<ComponentHealth> database = CompletableFuture
                .supplyAsync(this::probeDatabase, executor)
                .completeOnTimeout(
                        ComponentHealth.disconnected(0L,
                                "Database probe timed out after " + databaseTimeout.toMillis() + " ms"),
                        databaseTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> ComponentHealth.disconnected(0L, describe(e)));

        ComponentHealth broker = probeBroker();

        HealthReport report = new HealthReport(database.join(), broker);
        if (report.isHealthy()) {
            log.debug("Health check passed: dbLatencyMs={}", report.getDatabase().getLatencyMs());
        } else {
            log.warn("Health check degraded: db={} ({}), mqtt={} ({})",
                    report.getDatabase().getStatus().getValue(), report.getDatabase().getError(),
                    report.getBroker().getStatus().getValue(), report.getBroker().getError());
        }
        return report;
    }

    private ComponentHealth probeDatabase() {
        long start = System.nanoTime();
        try {
            storageHealthProbe.ping();
            return ComponentHealth.connected(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        } catch (RuntimeException e) {
            log.debug("Database probe failed", e);
            return ComponentHealth.disconnected(0L, describe(e));
        }
    }

    private ComponentHealth probeBroker() {
        try {
            return messagingGateway.isConnected()
                    ? ComponentHealth.connected(null)
                    : ComponentHealth.disconnected(null, "MQTT client disconnected");
        } catch (RuntimeException e) {
            log.debug("Broker probe failed", e);
            return ComponentHealth.disconnected(null, describe(e));
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
