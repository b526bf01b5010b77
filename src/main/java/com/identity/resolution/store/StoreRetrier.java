package com.identity.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs store operations under a {@link RetryPolicy}. Only {@link TransientStoreException}
 * is retried; integrity failures such as {@link DuplicateAliasException} propagate at once.
 */
public class StoreRetrier {
    private static final Logger log = LoggerFactory.getLogger(StoreRetrier.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public StoreRetrier(RetryPolicy policy) {
        this(policy, d -> Thread.sleep(d.toMillis()));
    }

    StoreRetrier(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> T call(String operation, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (TransientStoreException e) {
                if (attempt >= policy.maxAttempts()) {
                    log.error("store.retry.exhausted operation={} attempts={} error={}",
                            operation, attempt, e.getMessage());
                    throw e;
                }
                Duration delay = policy.delayAfter(attempt);
                log.warn("store.retry operation={} attempt={} delayMs={} error={}",
                        operation, attempt, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientStoreException("Interrupted while retrying " + operation, e);
                }
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
