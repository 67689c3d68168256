package com.strmatch.matcher;

import java.util.Objects;

/**
 * Matcher that checks if the input is equal to the stored string.
 * The comparison is case-sensitive.
 */
public final class EqualMatcher implements Matcher {

    private final String value;

    public EqualMatcher(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean match(CharSequence input) {
        return value.contentEquals(input);
    }

    public String getValue() {
        return value;
    }

    @Override
    public MatcherType getType() {
        return MatcherType.EQUAL;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("equal[").append(value).append(']');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EqualMatcher other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatcherType.EQUAL, value);
    }

    @Override
    public String toString() {
        return "equal[" + value + "]";
    }
}
