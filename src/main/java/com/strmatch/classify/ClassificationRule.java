package com.strmatch.classify;

import com.strmatch.matcher.StringMatcher;

import java.util.Objects;

/**
 * A named matcher with the label it assigns.
 *
 * @param name    Rule name
 * @param matcher Matcher the input must satisfy
 * @param label   Label assigned on match
 */
public record ClassificationRule(String name, StringMatcher matcher, String label) {

    public ClassificationRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(matcher, "matcher");
        if (label == null) {
            label = name;
        }
    }

    @Override
    public String toString() {
        return name + " -> " + label + " (" + matcher.describe() + ")";
    }
}
