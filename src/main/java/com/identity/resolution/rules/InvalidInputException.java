package com.identity.resolution.rules;

import com.identity.resolution.core.ResolutionException;

/**
 * Thrown when a source record cannot be matched at all (blank, oversized or
 * control-character-laden name). The matcher recovers from it locally and
 * classifies the record as {@code invalid_input}.
 */
public class InvalidInputException extends ResolutionException {

    public InvalidInputException(String message) {
        super(message);
    }
}
