package com.identity.resolution.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The single authoritative record for a real-world client or opportunity.
 * The id is the join key used by every downstream rollup and never changes;
 * the canonical name may be edited.
 *
 * <p>Instances are immutable; stores publish a new instance for every change.</p>
 */
public final class CanonicalEntity {
    private final String id;
    private final String canonicalName;
    private final EntityType type;
    private final Map<String, String> metadata;
    private final EntityStatus status;
    private final String retiredInto;
    private final Instant createdAt;
    private final Instant updatedAt;

    private CanonicalEntity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.canonicalName = builder.canonicalName;
        this.type = builder.type;
        this.metadata = builder.metadata != null ? Map.copyOf(builder.metadata) : Map.of();
        this.status = builder.status != null ? builder.status : EntityStatus.ACTIVE;
        this.retiredInto = builder.retiredInto;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public EntityType getType() {
        return type;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public EntityStatus getStatus() {
        return status;
    }

    /**
     * Id of the entity that won the merge this entity lost, or null.
     */
    public String getRetiredInto() {
        return retiredInto;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status == EntityStatus.ACTIVE;
    }

    public CanonicalEntity withCanonicalName(String newName) {
        return builder(this).canonicalName(newName).updatedAt(Instant.now()).build();
    }

    public CanonicalEntity retired(String winnerId) {
        return builder(this)
                .status(EntityStatus.RETIRED)
                .retiredInto(winnerId)
                .updatedAt(Instant.now())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "id='" + id + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", type=" + type +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CanonicalEntity entity) {
        return new Builder()
                .id(entity.id)
                .canonicalName(entity.canonicalName)
                .type(entity.type)
                .metadata(entity.metadata)
                .status(entity.status)
                .retiredInto(entity.retiredInto)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
    }

    public static class Builder {
        private String id;
        private String canonicalName;
        private EntityType type;
        private Map<String, String> metadata;
        private EntityStatus status;
        private String retiredInto;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder status(EntityStatus status) {
            this.status = status;
            return this;
        }

        public Builder retiredInto(String retiredInto) {
            this.retiredInto = retiredInto;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CanonicalEntity build() {
            Objects.requireNonNull(canonicalName, "canonicalName is required");
            Objects.requireNonNull(type, "type is required");
            if (canonicalName.isBlank()) {
                throw new IllegalArgumentException("canonicalName must not be blank");
            }
            return new CanonicalEntity(this);
        }
    }
}
