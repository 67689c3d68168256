package com.strmatch.classify;

import java.util.Optional;

/**
 * Result of classifying a string.
 */
public final class ClassificationResult {

    private final String input;
    private final ClassificationRule rule;
    private final String label;
    private final String explanation;

    private ClassificationResult(String input, ClassificationRule rule, String label, String explanation) {
        this.input = input;
        this.rule = rule;
        this.label = label;
        this.explanation = explanation;
    }

    /**
     * Create a result for a matched rule.
     */
    public static ClassificationResult matched(String input, ClassificationRule rule) {
        String explanation = "Matched rule '" + rule.name() + "' with " + rule.matcher().describe();
        return new ClassificationResult(input, rule, rule.label(), explanation);
    }

    /**
     * Create a result for an input no rule matched.
     *
     * @param defaultLabel Fallback label, may be null
     */
    public static ClassificationResult unmatched(String input, String defaultLabel) {
        String explanation = defaultLabel != null
                ? "No rule matched - assigned default label '" + defaultLabel + "'"
                : "No rule matched";
        return new ClassificationResult(input, null, defaultLabel, explanation);
    }

    public String getInput() {
        return input;
    }

    /**
     * Check if a rule matched.
     */
    public boolean isMatched() {
        return rule != null;
    }

    /**
     * Get the matched rule name, if any.
     */
    public Optional<String> getRuleName() {
        return rule != null ? Optional.of(rule.name()) : Optional.empty();
    }

    /**
     * Get the assigned label: the matched rule's label, or the default label.
     */
    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    /**
     * Get human-readable explanation of the decision.
     */
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "ClassificationResult{" +
                "input='" + input + '\'' +
                ", matched=" + isMatched() +
                ", rule=" + (rule != null ? rule.name() : "none") +
                ", label=" + label +
                '}';
    }
}
