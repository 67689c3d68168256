package com.strmatch.matcher;

/**
 * One string matching strategy held inside a {@link StringMatcher}.
 * <p>
 * The set of strategies is closed: adding one means extending the permits
 * clause and {@link MatcherType}, which breaks every exhaustive switch until
 * it handles the new type.
 */
public sealed interface Matcher
        permits AlwaysFalseMatcher, AlwaysTrueMatcher, EqualMatcher, PrefixMatcher,
                SubstringMatcher, RegexMatcher, ListMatcher {

    /**
     * Test the given string against this strategy.
     *
     * @param input String to test, never null
     * @return true if the string matches
     */
    boolean match(CharSequence input);

    /**
     * Get the matcher type.
     */
    MatcherType getType();

    /**
     * Append the diagnostic representation of this strategy.
     *
     * @param out Target buffer
     */
    void print(StringBuilder out);
}
