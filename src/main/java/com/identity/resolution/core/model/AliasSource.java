package com.identity.resolution.core.model;

/**
 * Who created an alias.
 */
public enum AliasSource {
    /** Entered by a data steward. Implicit confidence 1.0. */
    MANUAL,
    /** Written by the pipeline after a high-confidence fuzzy or keyword match. */
    AUTO,
    /** Loaded from an alias seed file. */
    SEED,
    /** Former canonical name of an entity that lost a merge. */
    MERGE
}
