package com.strmatch.matcher;

import com.strmatch.exception.InvalidPatternException;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matcher that checks if a regular expression is found anywhere in the input.
 * <p>
 * Uses search semantics ({@link java.util.regex.Matcher#find()}): the pattern is
 * only anchored if it anchors itself with {@code ^} or {@code $}.
 * The pattern text is left out of the diagnostic output.
 */
public final class RegexMatcher implements Matcher {

    private final Pattern pattern;

    public RegexMatcher(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    /**
     * Compile a regex matcher from pattern text.
     *
     * @param regex Regular expression in {@link Pattern} syntax
     * @return Regex matcher
     * @throws InvalidPatternException if the expression does not compile
     */
    public static RegexMatcher compile(String regex) {
        Objects.requireNonNull(regex, "regex");
        try {
            return new RegexMatcher(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(regex, e);
        }
    }

    @Override
    public boolean match(CharSequence input) {
        return pattern.matcher(input).find();
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public MatcherType getType() {
        return MatcherType.REGEX;
    }

    @Override
    public void print(StringBuilder out) {
        out.append("regex");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RegexMatcher other
                && pattern.pattern().equals(other.pattern.pattern())
                && pattern.flags() == other.pattern.flags();
    }

    @Override
    public int hashCode() {
        return Objects.hash(MatcherType.REGEX, pattern.pattern(), pattern.flags());
    }

    @Override
    public String toString() {
        return "regex";
    }
}
