package com.identity.resolution.metrics;

import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchOutcome;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.UnresolvedReason;

import java.time.Duration;

/**
 * Metrics hook for matching and stewardship.
 * {@link NoOpMetricsService} is the default so that no metrics library is required at runtime.
 */
public interface MetricsService {

    void recordMatchDuration(MatchStrategy strategy, MatchOutcome outcome, Duration duration);

    void incrementAliasCreated(AliasSource source);

    void incrementEntityCreated(EntityType type);

    void incrementEntityMerged(EntityType type);

    void incrementUnresolved(UnresolvedReason reason);

    /**
     * Score of an accepted fuzzy or keyword match.
     */
    void recordSimilarityScore(double score);

    void recordRunSize(int records);

    void recordCacheHit();

    void recordCacheMiss();
}
