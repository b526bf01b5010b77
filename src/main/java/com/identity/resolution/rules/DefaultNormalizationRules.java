package com.identity.resolution.rules;

import com.identity.resolution.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for the simplified name variant.
 */
public final class DefaultNormalizationRules {

    /**
     * Corporate and administrative suffixes dropped for fuzzy and keyword comparison.
     * Multi-word forms come first so that "pty ltd" is removed as a unit.
     */
    public static final List<String> ADMINISTRATIVE_SUFFIXES = List.of(
            "pty ltd", "pte ltd", "ltd", "inc", "incorporated", "limited",
            "hospital", "health", "medical", "centre");

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NameNormalizer createDefaultNormalizer() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getOpportunityRules());
        rules.add(getSuffixRule());
        return new NameNormalizer(rules);
    }

    /**
     * Strips any run of trailing suffixes ("barwon health pty ltd" -> "barwon").
     * Requires a preceding word, so a name that is only a suffix survives.
     */
    public static NormalizationRule getSuffixRule() {
        String alternation = String.join("|", ADMINISTRATIVE_SUFFIXES);
        return NormalizationRule.forAllTypes("suffixes",
                "(?:\\s+(?:" + alternation + "))+$", "", 500);
    }

    /**
     * Opportunity titles carry case references, CCR numbers, date stamps and
     * shorthand that differ between CRM and ledger exports.
     */
    public static List<NormalizationRule> getOpportunityRules() {
        return List.of(
                NormalizationRule.forTypes("opportunity-case-ref",
                        "\\bcs\\d{8,}\\b", " ", 10, EntityType.OPPORTUNITY),
                NormalizationRule.forTypes("opportunity-ccr",
                        "\\bccr\\s*\\d+\\b", " ", 10, EntityType.OPPORTUNITY),
                NormalizationRule.forTypes("opportunity-date-stamp",
                        "\\b\\d{8}\\b", " ", 20, EntityType.OPPORTUNITY),
                NormalizationRule.forTypes("opportunity-prof-srvs",
                        "\\bprof\\s*srvs\\b", "professional services", 50, EntityType.OPPORTUNITY),
                NormalizationRule.forTypes("opportunity-maint",
                        "\\bmaint\\b", "maintenance", 50, EntityType.OPPORTUNITY),
                NormalizationRule.forTypes("opportunity-impl",
                        "\\bimpl\\b", "implementation", 50, EntityType.OPPORTUNITY)
        );
    }
}
