package com.identity.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Adapts an OpenTelemetry {@link Tracer} to {@link TracingService}.
 * Needs {@code opentelemetry-api} on the classpath.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        io.opentelemetry.api.trace.Span otel = builder.startSpan();
        return new Span() {
            @Override
            public void setAttribute(String key, String value) {
                otel.setAttribute(key, value);
            }

            @Override
            public void setAttribute(String key, long value) {
                otel.setAttribute(key, value);
            }

            @Override
            public void setStatus(SpanStatus status) {
                otel.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
            }

            @Override
            public void recordException(Throwable t) {
                otel.recordException(t);
            }

            @Override
            public void close() {
                otel.end();
            }
        };
    }
}
