package com.identity.resolution.store;

import java.util.List;

/**
 * A merge would leave two active aliases with the same text and scope pointing at
 * different entities. The merge is aborted with nothing repointed; the conflicting
 * aliases must be resolved first.
 */
public class MergeConflictException extends StoreException {

    private final String winnerId;
    private final String loserId;
    private final List<String> conflictingAliases;

    public MergeConflictException(String winnerId, String loserId, List<String> conflictingAliases) {
        super("Merging " + loserId + " into " + winnerId
                + " would duplicate aliases " + conflictingAliases);
        this.winnerId = winnerId;
        this.loserId = loserId;
        this.conflictingAliases = List.copyOf(conflictingAliases);
    }

    public String getWinnerId() {
        return winnerId;
    }

    public String getLoserId() {
        return loserId;
    }

    /**
     * Conflicting alias keys as {@code scope:text}.
     */
    public List<String> getConflictingAliases() {
        return conflictingAliases;
    }
}
