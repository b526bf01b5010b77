package com.identity.resolution.core;

/**
 * Root of the resolution error taxonomy. All subclasses are unchecked.
 */
public abstract class ResolutionException extends RuntimeException {

    protected ResolutionException(String message) {
        super(message);
    }

    protected ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
