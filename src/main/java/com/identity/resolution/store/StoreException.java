package com.identity.resolution.store;

import com.identity.resolution.core.ResolutionException;

/**
 * Base class for failures raised by a {@link CanonicalStore}.
 * Only {@link TransientStoreException} is retryable.
 */
public class StoreException extends ResolutionException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
