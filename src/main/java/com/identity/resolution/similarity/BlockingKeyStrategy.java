package com.identity.resolution.similarity;

import java.util.Set;

/**
 * Generates blocking keys that bucket names before fuzzy and keyword scoring,
 * so a record is only compared with candidates sharing at least one key.
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedName a normalized name
     * @return blocking keys (never null, empty for an empty name)
     */
    Set<String> generateKeys(String normalizedName);
}
