package com.strmatch.matcher;

import java.util.Objects;

/**
 * Matcher that checks if the input starts with the stored prefix.
 * An empty prefix matches every string.
 */
public final class PrefixMatcher implements Matcher {

    private final String prefix;

    public PrefixMatcher(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public boolean match(CharSequence input) {
        if (input.length() < prefix.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (input.charAt(i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public MatcherType getType() {
        return MatcherType.PREFIX;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("prefix[").append(prefix).append(']');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PrefixMatcher other && prefix.equals(other.prefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatcherType.PREFIX, prefix);
    }

    @Override
    public String toString() {
        return "prefix[" + prefix + "]";
    }
}
