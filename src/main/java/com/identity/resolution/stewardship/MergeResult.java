package com.identity.resolution.stewardship;

import com.identity.resolution.store.MergeSummary;

/**
 * Result of a steward-initiated merge.
 */
public record MergeResult(boolean success, MergeSummary summary, String errorMessage) {

    public static MergeResult success(MergeSummary summary) {
        return new MergeResult(true, summary, null);
    }

    public static MergeResult failure(String errorMessage) {
        return new MergeResult(false, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
