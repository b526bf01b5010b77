package com.identity.resolution.tracing;

/**
 * A traced unit of work, ended by {@link #close()} so it fits try-with-resources:
 * <pre>
 * try (Span span = tracing.startSpan("resolution.run")) {
 *     span.setAttribute("runId", runId);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
