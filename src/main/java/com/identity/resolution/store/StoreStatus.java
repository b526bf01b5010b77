package com.identity.resolution.store;

/**
 * Row counts of the four logical tables, for operator status reports.
 */
public record StoreStatus(long activeEntities, long retiredEntities, long activeAliases,
                          long matchResults, long pendingUnresolved) {

    @Override
    public String toString() {
        return "StoreStatus{entities=" + activeEntities +
                ", retired=" + retiredEntities +
                ", aliases=" + activeAliases +
                ", matchResults=" + matchResults +
                ", pendingUnresolved=" + pendingUnresolved + '}';
    }
}
