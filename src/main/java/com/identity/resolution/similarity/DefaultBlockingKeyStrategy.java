package com.identity.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default blocking keys:
 * <ul>
 *   <li><b>First letter</b> of the name ({@code pfx:w}): catches typo-level variants for fuzzy scoring</li>
 *   <li><b>Significant tokens</b> ({@code tok:imaging}): catches reordered or abbreviated names
 *       for keyword scoring</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private final TokenOverlapSimilarity tokenizer;

    public DefaultBlockingKeyStrategy() {
        this(new TokenOverlapSimilarity());
    }

    public DefaultBlockingKeyStrategy(TokenOverlapSimilarity tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        String cleaned = normalizedName.trim();
        keys.add("pfx:" + cleaned.charAt(0));
        for (String token : tokenizer.tokenize(cleaned)) {
            keys.add("tok:" + token);
        }
        return keys;
    }
}
