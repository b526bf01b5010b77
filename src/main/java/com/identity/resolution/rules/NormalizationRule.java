package com.identity.resolution.rules;

import com.identity.resolution.core.model.EntityType;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Regex rewrite applied while building the simplified form of a name.
 * Rules run over already-normalized text (lowercase, {@code [a-z0-9 ]} only),
 * in ascending priority, and may be scoped to specific entity types.
 *
 * @param name        unique rule name, used in debug logging
 * @param pattern     compiled pattern
 * @param replacement replacement text ({@link java.util.regex.Matcher#replaceAll} syntax)
 * @param types       entity types the rule applies to; empty means all types
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement,
                                Set<EntityType> types, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        types = types != null ? Set.copyOf(types) : Set.of();
    }

    public static NormalizationRule forAllTypes(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex), replacement, Set.of(), priority);
    }

    public static NormalizationRule forTypes(String name, String regex, String replacement, int priority,
                                             EntityType... types) {
        return new NormalizationRule(name, Pattern.compile(regex), replacement, Set.of(types), priority);
    }

    /**
     * Untyped rules apply to everything. Typed rules need a matching type;
     * a null type (caller does not know it) only gets untyped rules.
     */
    public boolean appliesTo(EntityType type) {
        return types.isEmpty() || (type != null && types.contains(type));
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
