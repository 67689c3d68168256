package com.strmatch.matcher;

/**
 * Tag of the matching strategy held by a {@link StringMatcher}.
 */
public enum MatcherType {
    // Constant
    ALWAYS_FALSE,
    ALWAYS_TRUE,

    // Text
    EQUAL,
    PREFIX,
    SUBSTRING,

    // Pattern
    REGEX,

    // Collection
    LIST
}
