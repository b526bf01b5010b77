package com.identity.resolution.metrics;

import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchOutcome;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.UnresolvedReason;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(MatchStrategy strategy, MatchOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementAliasCreated(AliasSource source) {
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
    }

    @Override
    public void incrementUnresolved(UnresolvedReason reason) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordRunSize(int records) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
