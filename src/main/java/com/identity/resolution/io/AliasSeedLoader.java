package com.identity.resolution.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.DuplicateAliasException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads canonical entities and their known aliases from a JSON seed file into a store,
 * through the store's regular write path:
 *
 * <pre>
 * {"entities": [
 *   {"id": "client-wa-health", "canonicalName": "Western Australia Department Of Health",
 *    "type": "CLIENT", "aliases": ["WA Health"], "referenceNumbers": ["Q-1001"]}
 * ]}
 * </pre>
 *
 * <p>Loading the same file twice is a no-op. An entry without an id is matched to an
 * existing entity by name before a new one is created.</p>
 */
public class AliasSeedLoader {
    private static final Logger log = LoggerFactory.getLogger(AliasSeedLoader.class);

    private final CanonicalStore store;
    private final ObjectMapper objectMapper;

    public AliasSeedLoader(CanonicalStore store) {
        this(store, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public AliasSeedLoader(CanonicalStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public SeedReport load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Loads a seed file from the classpath.
     *
     * @throws IOException if the resource does not exist or cannot be parsed
     */
    public SeedReport loadResource(String resource) throws IOException {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IOException("Seed resource not found: " + resource);
            }
            return load(in);
        }
    }

    public SeedReport load(InputStream in) throws IOException {
        SeedFile file = objectMapper.readValue(in, SeedFile.class);
        List<SeedEntity> entities = file.entities() != null ? file.entities() : List.of();

        int created = 0;
        int existing = 0;
        int aliases = 0;
        List<String> conflicts = new ArrayList<>();

        for (SeedEntity seed : entities) {
            if (seed.canonicalName() == null || seed.canonicalName().isBlank()) {
                throw new IOException("Seed entry without canonicalName: id=" + seed.id());
            }
            EntityType type = EntityType.fromCode(seed.type() != null ? seed.type() : EntityType.CLIENT.name());

            Optional<CanonicalEntity> known = findExisting(seed);
            CanonicalEntity entity;
            if (known.isPresent()) {
                entity = known.get();
                existing++;
            } else {
                try {
                    entity = store.createEntity(CanonicalEntity.builder()
                            .id(seed.id())
                            .canonicalName(seed.canonicalName().trim())
                            .type(type)
                            .metadata(seed.metadata())
                            .build());
                } catch (DuplicateAliasException e) {
                    log.warn("seed.entity.conflict canonicalName='{}' existingId={} seedId={}",
                            seed.canonicalName(), e.getExistingCanonicalId(), seed.id());
                    conflicts.add(AliasScope.NAME.name() + ":" + seed.canonicalName());
                    continue;
                }
                created++;
            }

            aliases += insertAll(seed.aliases(), entity.getId(), AliasScope.NAME, conflicts);
            aliases += insertAll(seed.referenceNumbers(), entity.getId(), AliasScope.REFERENCE_NUMBER, conflicts);
        }

        SeedReport report = new SeedReport(created, existing, aliases, conflicts);
        log.info("seed.loaded entitiesCreated={} entitiesExisting={} aliases={} conflicts={}",
                created, existing, aliases, conflicts.size());
        return report;
    }

    private Optional<CanonicalEntity> findExisting(SeedEntity seed) {
        if (seed.id() != null) {
            return store.findEntity(seed.id());
        }
        List<String> owners = store.findNameOwners(seed.canonicalName());
        if (owners.size() > 1) {
            log.warn("seed.name.shared canonicalName='{}' owners={} using={}",
                    seed.canonicalName(), owners, owners.get(0));
        }
        return owners.stream().findFirst().flatMap(store::findEntity);
    }

    private int insertAll(List<String> texts, String canonicalId, AliasScope scope, List<String> conflicts) {
        if (texts == null) {
            return 0;
        }
        int inserted = 0;
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            try {
                store.insertAlias(text, canonicalId, scope, AliasSource.SEED, 1.0);
                inserted++;
            } catch (DuplicateAliasException e) {
                log.warn("seed.alias.conflict alias='{}' scope={} existingId={} seedId={}",
                        text, scope, e.getExistingCanonicalId(), canonicalId);
                conflicts.add(scope.name() + ":" + text);
            }
        }
        return inserted;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedFile(List<SeedEntity> entities) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedEntity(String id, String canonicalName, String type, Map<String, String> metadata,
                      List<String> aliases, List<String> referenceNumbers) {
    }
}
