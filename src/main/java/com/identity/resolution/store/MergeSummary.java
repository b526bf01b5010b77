package com.identity.resolution.store;

/**
 * What a completed merge changed.
 *
 * @param winnerId              surviving canonical id
 * @param loserId               retired canonical id
 * @param aliasesRepointed      aliases moved from loser to winner
 * @param matchResultsRepointed match results moved from loser to winner
 * @param unresolvedRepointed   unresolved records whose candidate or resolution moved
 * @param formerNameAliased     whether the loser's canonical name became an alias of the winner
 */
public record MergeSummary(String winnerId, String loserId, int aliasesRepointed,
                           int matchResultsRepointed, int unresolvedRepointed,
                           boolean formerNameAliased) {
}
