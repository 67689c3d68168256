package com.strmatch.config;

/**
 * Configuration for a classification rule.
 *
 * @param name    Rule name, used in explanations and logs
 * @param matcher Matcher the input must satisfy
 * @param label   Label assigned when the rule matches (defaults to the name)
 */
public record RuleConfig(
        String name,
        MatcherConfig matcher,
        String label
) {
    public RuleConfig {
        if (label == null || label.isBlank()) {
            label = name;
        }
    }
}
