package com.identity.resolution.store;

/**
 * I/O or connection failure talking to the backing store. Retried with backoff.
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
