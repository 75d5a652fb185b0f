package com.koni.greenhouse.infrastructure.tracing;

import com.hivemq.client.mqtt.mqtt5.datatypes.Mqtt5UserProperties;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Propagates distributed tracing context on outgoing MQTT messages.
 * Adds the current trace ID and span ID as MQTT 5 user properties
 * (X-B3-TraceId, X-B3-SpanId) so that devices and bridges can correlate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TraceUserProperties {

    static final String TRACE_ID = "X-B3-TraceId";
    static final String SPAN_ID = "X-B3-SpanId";

    private final Tracer tracer;

    /**
     * @return user properties carrying the current trace context, or none if no span is active
     */
    public Mqtt5UserProperties current() {
        Span span = tracer.currentSpan();
        if (span == null) {
            log.debug("No active span found, skipping trace context propagation");
            return Mqtt5UserProperties.of();
        }

        String traceId = span.context().traceId();
        String spanId = span.context().spanId();
        log.debug("Added trace context to MQTT message: traceId={}, spanId={}", traceId, spanId);
        return Mqtt5UserProperties.builder()
                .add(TRACE_ID, traceId)
                .add(SPAN_ID, spanId)
                .build();
    }
}
