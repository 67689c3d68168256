package com.strmatch.config;

import java.util.List;

/**
 * Root configuration for a classifier.
 *
 * @param name         Classifier name
 * @param version      Configuration version
 * @param rules        Rules in evaluation order
 * @param defaultLabel Label for inputs no rule matches, or null to leave them unmatched
 */
public record ClassifierConfig(
        String name,
        String version,
        List<RuleConfig> rules,
        String defaultLabel
) {
    public ClassifierConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Get a rule by name.
     *
     * @return the rule, or null if none has that name
     */
    public RuleConfig getRule(String ruleName) {
        return rules.stream()
                .filter(r -> r.name().equals(ruleName))
                .findFirst()
                .orElse(null);
    }
}
