package com.identity.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC entries scoped to a try-with-resources block. Closing restores whatever the
 * keys held before, so a record context nested in a run context keeps the run's entries.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRecord(runId, record.sourceId())) {
 *     log.info("pipeline.record.matched canonicalId={}", id);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // key -> value before this context, null when absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        return new LogContext()
                .with("runId", runId)
                .with("operation", "run");
    }

    public static LogContext forRecord(String runId, String sourceId) {
        return new LogContext()
                .with("runId", runId)
                .with("sourceId", sourceId)
                .with("operation", "match");
    }

    public static LogContext forMerge(String correlationId, String winnerId, String loserId) {
        return new LogContext()
                .with("correlationId", correlationId)
                .with("winnerId", winnerId)
                .with("loserId", loserId)
                .with("operation", "merge");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
