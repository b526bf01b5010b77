package com.identity.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A known alternate spelling or reference number for a canonical entity.
 *
 * <p>{@code lookupKey} is the comparable form used for exact resolution: the
 * normalized text for name aliases, the trimmed text for reference numbers.
 * Among active aliases, {@code (lookupKey, scope)} is unique.</p>
 */
public final class Alias {
    private final String aliasText;
    private final String lookupKey;
    private final String canonicalId;
    private final AliasScope scope;
    private final AliasSource source;
    private final double confidence;
    private final boolean active;
    private final Instant createdAt;

    private Alias(Builder builder) {
        this.aliasText = builder.aliasText;
        this.lookupKey = builder.lookupKey;
        this.canonicalId = builder.canonicalId;
        this.scope = builder.scope;
        this.source = builder.source;
        this.confidence = builder.confidence;
        this.active = builder.active;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getAliasText() {
        return aliasText;
    }

    public String getLookupKey() {
        return lookupKey;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    public AliasScope getScope() {
        return scope;
    }

    public AliasSource getSource() {
        return source;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Same alias pointing at a different canonical entity (merge repoint).
     */
    public Alias repointedTo(String newCanonicalId) {
        return builder(this).canonicalId(newCanonicalId).build();
    }

    public Alias deactivated() {
        return builder(this).active(false).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alias alias = (Alias) o;
        return active == alias.active
                && Objects.equals(lookupKey, alias.lookupKey)
                && scope == alias.scope
                && Objects.equals(canonicalId, alias.canonicalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lookupKey, scope, canonicalId, active);
    }

    @Override
    public String toString() {
        return "Alias{" +
                "aliasText='" + aliasText + '\'' +
                ", scope=" + scope +
                ", canonicalId='" + canonicalId + '\'' +
                ", source=" + source +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Alias alias) {
        return new Builder()
                .aliasText(alias.aliasText)
                .lookupKey(alias.lookupKey)
                .canonicalId(alias.canonicalId)
                .scope(alias.scope)
                .source(alias.source)
                .confidence(alias.confidence)
                .active(alias.active)
                .createdAt(alias.createdAt);
    }

    public static class Builder {
        private String aliasText;
        private String lookupKey;
        private String canonicalId;
        private AliasScope scope = AliasScope.NAME;
        private AliasSource source = AliasSource.MANUAL;
        private double confidence = 1.0;
        private boolean active = true;
        private Instant createdAt;

        public Builder aliasText(String aliasText) {
            this.aliasText = aliasText;
            return this;
        }

        public Builder lookupKey(String lookupKey) {
            this.lookupKey = lookupKey;
            return this;
        }

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder scope(AliasScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder source(AliasSource source) {
            this.source = source;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Alias build() {
            Objects.requireNonNull(aliasText, "aliasText is required");
            Objects.requireNonNull(lookupKey, "lookupKey is required");
            Objects.requireNonNull(canonicalId, "canonicalId is required");
            Objects.requireNonNull(scope, "scope is required");
            Objects.requireNonNull(source, "source is required");
            return new Alias(this);
        }
    }
}
