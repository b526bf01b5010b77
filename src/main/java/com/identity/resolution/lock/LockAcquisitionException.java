package com.identity.resolution.lock;

import com.identity.resolution.core.ResolutionException;

/**
 * A creation lock could not be taken in time.
 */
public class LockAcquisitionException extends ResolutionException {

    private final String key;

    public LockAcquisitionException(String key, String detail) {
        super("Lock '" + key + "' " + detail);
        this.key = key;
    }

    public LockAcquisitionException(String key, String detail, Throwable cause) {
        super("Lock '" + key + "' " + detail, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
