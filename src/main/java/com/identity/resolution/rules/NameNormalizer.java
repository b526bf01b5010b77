package com.identity.resolution.rules;

import com.identity.resolution.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw names into comparable forms. Pure and thread-safe once built.
 *
 * <p>Two variants are produced:</p>
 * <ul>
 *   <li>{@link #normalize(String)}: lowercase, underscores and Unicode spaces as separators, everything
 *       outside {@code [a-z0-9\s]} stripped, whitespace collapsed and trimmed. Used for
 *       exact alias lookups and stays suffix-sensitive.</li>
 *   <li>{@link #simplify(String, EntityType)}: the normalized form with the configured
 *       rules applied (trailing corporate suffixes, opportunity shorthand). Used for
 *       keyword comparison only.</li>
 * </ul>
 * Both are idempotent.
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    // no-break and other Unicode spaces; \s only matches ASCII whitespace
    private static final Pattern SEPARATORS = Pattern.compile("\\p{Z}+");
    private static final Pattern NOT_ALLOWED = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NameNormalizer() {
        this(List.of());
    }

    public NameNormalizer(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalized form; null and blank input yield the empty string.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String result = raw.toLowerCase(Locale.ROOT);
        result = UNDERSCORES.matcher(result).replaceAll(" ");
        result = SEPARATORS.matcher(result).replaceAll(" ");
        result = NOT_ALLOWED.matcher(result).replaceAll("");
        return collapse(result);
    }

    /**
     * Simplified form for the given entity type (null applies untyped rules only).
     */
    public String simplify(String raw, EntityType type) {
        String result = normalize(raw);
        if (result.isEmpty()) {
            return result;
        }
        for (NormalizationRule rule : rules) {
            if (!rule.appliesTo(type)) {
                continue;
            }
            String before = result;
            result = collapse(rule.apply(result));
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' rewrote '{}' -> '{}'", rule.name(), before, result);
            }
        }
        return result;
    }

    public boolean areEquivalent(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    private static String collapse(String s) {
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }
}
