package com.identity.resolution.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Compensating transaction for multi-statement graph writes such as merges.
 * Steps that completed are undone in reverse order when a later step fails or
 * when the transaction is closed without {@link #markSuccess()}.
 *
 * <pre>
 * try (StoreTransaction tx = new StoreTransaction("merge")) {
 *     tx.execute("retire loser", () -> retire(loser), () -> reactivate(loser));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final String name;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private boolean success;
    private boolean closed;

    public StoreTransaction(String name) {
        this.name = name;
    }

    public void execute(String step, Runnable operation, Runnable compensation) {
        call(step, () -> {
            operation.run();
            return null;
        }, ignored -> compensation.run());
    }

    /**
     * Runs a step whose compensation needs the step's own result, e.g. the ids it touched.
     */
    public <T> T call(String step, Supplier<T> operation, Consumer<T> compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction " + name + " is already closed");
        }
        try {
            log.debug("tx.step name={} step='{}'", name, step);
            T result = operation.get();
            compensations.push(new Compensation(step, () -> compensation.accept(result)));
            return result;
        } catch (RuntimeException e) {
            log.warn("tx.step.failed name={} step='{}' error={}", name, step, e.getMessage());
            rollback();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("tx.abandoned name={} compensations={}", name, compensations.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        while (!compensations.isEmpty()) {
            Compensation c = compensations.pop();
            try {
                c.action().run();
            } catch (RuntimeException e) {
                log.error("tx.compensation.failed name={} step='{}' error={}", name, c.step(), e.getMessage());
            }
        }
    }

    private record Compensation(String step, Runnable action) {}
}
