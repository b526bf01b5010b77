package com.identity.resolution.dedup;

public enum WriteOutcome {
    INSERTED,
    /** A derived record with the same reference number or normalized name already exists. */
    EXISTING,
    /** Neither a usable reference number nor a name; nothing to key the record on. */
    SKIPPED
}
