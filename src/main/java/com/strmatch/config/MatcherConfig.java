package com.strmatch.config;

import com.strmatch.matcher.MatcherType;

import java.util.List;

/**
 * Configuration for a single matcher.
 *
 * @param type    Matcher type (EQUAL, PREFIX, LIST, etc.)
 * @param value   Text for EQUAL/PREFIX/SUBSTRING matchers
 * @param values  Values for LIST matchers
 * @param pattern Regular expression for REGEX matchers
 */
public record MatcherConfig(
        MatcherType type,
        String value,
        List<String> values,
        String pattern
) {
    public static MatcherConfig alwaysFalse() {
        return new MatcherConfig(MatcherType.ALWAYS_FALSE, null, null, null);
    }

    public static MatcherConfig alwaysTrue() {
        return new MatcherConfig(MatcherType.ALWAYS_TRUE, null, null, null);
    }

    public static MatcherConfig equal(String value) {
        return new MatcherConfig(MatcherType.EQUAL, value, null, null);
    }

    public static MatcherConfig prefix(String value) {
        return new MatcherConfig(MatcherType.PREFIX, value, null, null);
    }

    public static MatcherConfig substring(String value) {
        return new MatcherConfig(MatcherType.SUBSTRING, value, null, null);
    }

    public static MatcherConfig regex(String pattern) {
        return new MatcherConfig(MatcherType.REGEX, null, null, pattern);
    }

    public static MatcherConfig list(List<String> values) {
        return new MatcherConfig(MatcherType.LIST, null, values, null);
    }
}
