package com.identity.resolution.store;

/**
 * A write referenced a canonical id that does not exist or is retired.
 */
public class EntityNotFoundException extends StoreException {

    private final String entityId;

    public EntityNotFoundException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public static EntityNotFoundException missing(String entityId) {
        return new EntityNotFoundException(entityId, "Canonical entity not found: " + entityId);
    }

    public static EntityNotFoundException retired(String entityId) {
        return new EntityNotFoundException(entityId, "Canonical entity is retired: " + entityId);
    }

    public String getEntityId() {
        return entityId;
    }
}
