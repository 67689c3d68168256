package com.strmatch.matcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Matches strings using exactly one of the strategies in {@link Matcher}.
 * <p>
 * Instances are created through the static factories, which map common literal
 * forms onto a strategy:
 * <ul>
 *   <li>{@code boolean} to {@link AlwaysTrueMatcher} / {@link AlwaysFalseMatcher}</li>
 *   <li>{@code String} to {@link EqualMatcher}</li>
 *   <li>{@link Pattern} to {@link RegexMatcher}</li>
 *   <li>{@code List<String>} to {@link ListMatcher}</li>
 * </ul>
 * Prefix and substring matching have no literal form and are created with
 * {@link #prefix(String)} and {@link #substring(String)} or {@link #of(Matcher)}.
 * <p>
 * A StringMatcher never changes which strategy it holds. It is safe to share
 * between threads as long as a held {@link ListMatcher} is not modified
 * concurrently.
 */
public final class StringMatcher implements Predicate<String> {

    private final Matcher matcher;

    /**
     * Create a string matcher that will never match.
     */
    public StringMatcher() {
        this(AlwaysFalseMatcher.INSTANCE);
    }

    private StringMatcher(Matcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * Create a string matcher from an explicit strategy.
     */
    public static StringMatcher of(Matcher matcher) {
        return new StringMatcher(matcher);
    }

    /**
     * Create a string matcher that will always or never match.
     * Shortcut for {@link #alwaysTrue()} or {@link #alwaysFalse()}.
     */
    public static StringMatcher of(boolean result) {
        return result ? alwaysTrue() : alwaysFalse();
    }

    /**
     * Create a string matcher that matches the given string exactly.
     * Shortcut for {@link #equal(String)}.
     */
    public static StringMatcher of(String value) {
        return equal(value);
    }

    /**
     * Create a string matcher that searches for the given pattern.
     */
    public static StringMatcher of(Pattern pattern) {
        return new StringMatcher(new RegexMatcher(pattern));
    }

    /**
     * Create a string matcher that matches any of the given strings.
     * The list is copied.
     */
    public static StringMatcher of(List<String> values) {
        return new StringMatcher(new ListMatcher(values));
    }

    public static StringMatcher alwaysFalse() {
        return new StringMatcher(AlwaysFalseMatcher.INSTANCE);
    }

    public static StringMatcher alwaysTrue() {
        return new StringMatcher(AlwaysTrueMatcher.INSTANCE);
    }

    public static StringMatcher equal(String value) {
        return new StringMatcher(new EqualMatcher(value));
    }

    public static StringMatcher prefix(String prefix) {
        return new StringMatcher(new PrefixMatcher(prefix));
    }

    public static StringMatcher substring(String substring) {
        return new StringMatcher(new SubstringMatcher(substring));
    }

    /**
     * Create a string matcher from regular expression text.
     *
     * @throws com.strmatch.exception.InvalidPatternException if the expression does not compile
     */
    public static StringMatcher regex(String regex) {
        return new StringMatcher(RegexMatcher.compile(regex));
    }

    public static StringMatcher anyOf(String... values) {
        return of(Arrays.asList(values));
    }

    /**
     * Match the given string against the held strategy.
     *
     * @param input String to test
     * @return true if the held strategy matches
     */
    public boolean matches(CharSequence input) {
        Objects.requireNonNull(input, "input");
        return matcher.match(input);
    }

    @Override
    public boolean test(String input) {
        return matches(input);
    }

    /**
     * Get the held strategy.
     */
    public Matcher getMatcher() {
        return matcher;
    }

    public MatcherType getType() {
        return matcher.getType();
    }

    /**
     * Get the diagnostic representation, e.g. {@code equal[foo]} or {@code list[[a][b]]}.
     * Meant for logging; do not parse it.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        matcher.print(sb);
        return sb.toString();
    }

    /**
     * Write the diagnostic representation to the given sink.
     *
     * @param out Target sink
     * @return the sink
     */
    public <A extends Appendable> A print(A out) {
        try {
            out.append(describe());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to print matcher " + describe(), e);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringMatcher other && matcher.equals(other.matcher);
    }

    @Override
    public int hashCode() {
        return matcher.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }
}
