package com.identity.resolution.lock;

import java.time.Duration;

/**
 * @param timeout maximum wait for a creation lock
 */
public record LockConfig(Duration timeout) {

    public LockConfig {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * 5 second timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(5));
    }
}
