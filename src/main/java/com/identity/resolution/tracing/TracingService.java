package com.identity.resolution.tracing;

import java.util.Map;

/**
 * Tracing hook. {@link NoOpTracingService} is used unless a tracer is supplied.
 */
public interface TracingService {

    String RUN_SPAN = "resolution.run";
    String MERGE_SPAN = "resolution.merge";

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
