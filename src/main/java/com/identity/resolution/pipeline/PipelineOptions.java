package com.identity.resolution.pipeline;

import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.match.MatcherConfig;
import com.identity.resolution.store.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for a resolution pipeline run.
 */
public class PipelineOptions {

    private static final double DEFAULT_AUTO_ALIAS_THRESHOLD = 0.95;

    private final MatcherConfig matcherConfig;
    private final double autoAliasThreshold;
    private final boolean autoCreateCanonical;
    private final EntityType autoCreateEntityType;
    private final int workerThreads;
    private final Duration batchTimeout;
    private final RetryPolicy retryPolicy;
    private final String derivedTargetSystem;

    private PipelineOptions(Builder builder) {
        this.matcherConfig = builder.matcherConfig;
        this.autoAliasThreshold = builder.autoAliasThreshold;
        this.autoCreateCanonical = builder.autoCreateCanonical;
        this.autoCreateEntityType = builder.autoCreateEntityType;
        this.workerThreads = builder.workerThreads;
        this.batchTimeout = builder.batchTimeout;
        this.retryPolicy = builder.retryPolicy;
        this.derivedTargetSystem = builder.derivedTargetSystem;
    }

    public MatcherConfig getMatcherConfig() {
        return matcherConfig;
    }

    /**
     * Minimum fuzzy or keyword confidence at which the matched name is written back
     * as an alias, so the next run takes the exact-name path.
     */
    public double getAutoAliasThreshold() {
        return autoAliasThreshold;
    }

    public boolean isAutoCreateCanonical() {
        return autoCreateCanonical;
    }

    /**
     * Type of auto-created entities when the record has no {@code entity_type} attribute.
     */
    public EntityType getAutoCreateEntityType() {
        return autoCreateEntityType;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Time after which workers stop taking new records; null means no limit.
     */
    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * Target system for derived "no counterpart" records; null disables the dedup writer.
     */
    public String getDerivedTargetSystem() {
        return derivedTargetSystem;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatcherConfig matcherConfig = MatcherConfig.defaults();
        private double autoAliasThreshold = DEFAULT_AUTO_ALIAS_THRESHOLD;
        private boolean autoCreateCanonical = false;
        private EntityType autoCreateEntityType = EntityType.CLIENT;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private Duration batchTimeout;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private String derivedTargetSystem;

        public Builder matcherConfig(MatcherConfig matcherConfig) {
            this.matcherConfig = matcherConfig;
            return this;
        }

        public Builder autoAliasThreshold(double autoAliasThreshold) {
            this.autoAliasThreshold = autoAliasThreshold;
            return this;
        }

        public Builder autoCreateCanonical(boolean autoCreateCanonical) {
            this.autoCreateCanonical = autoCreateCanonical;
            return this;
        }

        public Builder autoCreateEntityType(EntityType autoCreateEntityType) {
            this.autoCreateEntityType = autoCreateEntityType;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder derivedTargetSystem(String derivedTargetSystem) {
            this.derivedTargetSystem = derivedTargetSystem;
            return this;
        }

        public PipelineOptions build() {
            Objects.requireNonNull(matcherConfig, "matcherConfig is required");
            Objects.requireNonNull(autoCreateEntityType, "autoCreateEntityType is required");
            Objects.requireNonNull(retryPolicy, "retryPolicy is required");
            if (autoAliasThreshold < 0.0 || autoAliasThreshold > 1.0) {
                throw new IllegalArgumentException("autoAliasThreshold must be between 0.0 and 1.0");
            }
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be > 0");
            }
            if (batchTimeout != null && (batchTimeout.isNegative() || batchTimeout.isZero())) {
                throw new IllegalArgumentException("batchTimeout must be positive");
            }
            return new PipelineOptions(this);
        }
    }
}
