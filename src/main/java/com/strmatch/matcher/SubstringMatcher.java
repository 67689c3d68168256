package com.strmatch.matcher;

import java.util.Objects;

/**
 * Matcher that checks if the stored string occurs anywhere in the input.
 * An empty substring matches every string.
 */
public final class SubstringMatcher implements Matcher {

    private final String substring;

    public SubstringMatcher(String substring) {
        this.substring = Objects.requireNonNull(substring, "substring");
    }

    @Override
    public boolean match(CharSequence input) {
        return input.toString().contains(substring);
    }

    public String getSubstring() {
        return substring;
    }

    @Override
    public MatcherType getType() {
        return MatcherType.SUBSTRING;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("substring[").append(substring).append(']');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SubstringMatcher other && substring.equals(other.substring);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatcherType.SUBSTRING, substring);
    }

    @Override
    public String toString() {
        return "substring[" + substring + "]";
    }
}
