package com.identity.resolution.store;

import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.rules.NameNormalizer;
import com.identity.resolution.similarity.BlockingKeyStrategy;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lookup and blocking keys shared by every store implementation, so that the
 * matcher and the store always agree on how text is compared.
 */
public class AliasKeys {

    private final NameNormalizer normalizer;
    private final BlockingKeyStrategy blockingStrategy;

    public AliasKeys(NameNormalizer normalizer, BlockingKeyStrategy blockingStrategy) {
        this.normalizer = normalizer;
        this.blockingStrategy = blockingStrategy;
    }

    /**
     * Exact-lookup key: normalized text for names (suffix-sensitive), trimmed
     * upper-case text for reference numbers.
     */
    public String lookupKey(String text, AliasScope scope) {
        if (text == null) {
            return "";
        }
        return scope == AliasScope.REFERENCE_NUMBER
                ? text.trim().toUpperCase(Locale.ROOT)
                : normalizer.normalize(text);
    }

    /**
     * Blocking keys under which a stored name is indexed: keys of its normalized
     * form plus keys of its simplified form for the owning entity's type.
     */
    public Set<String> indexKeys(String text, EntityType type) {
        Set<String> keys = new LinkedHashSet<>(blockingStrategy.generateKeys(normalizer.normalize(text)));
        keys.addAll(blockingStrategy.generateKeys(normalizer.simplify(text, type)));
        return keys;
    }

    /**
     * Blocking keys to search for a raw record name, whose type is not known up front.
     */
    public Set<String> searchKeys(String rawName) {
        Set<String> keys = new LinkedHashSet<>(blockingStrategy.generateKeys(normalizer.normalize(rawName)));
        for (EntityType type : EntityType.values()) {
            keys.addAll(blockingStrategy.generateKeys(normalizer.simplify(rawName, type)));
        }
        return keys;
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }
}
