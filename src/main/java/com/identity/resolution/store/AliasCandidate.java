package com.identity.resolution.store;

import com.identity.resolution.core.model.EntityType;

/**
 * A name the matcher may score a record against: an active name alias or the
 * canonical name of an active entity.
 *
 * @param text           display text as entered
 * @param normalizedText normalized form of {@code text}
 * @param canonicalId    entity the name resolves to
 * @param entityType     type of that entity
 */
public record AliasCandidate(String text, String normalizedText, String canonicalId, EntityType entityType) {
}
