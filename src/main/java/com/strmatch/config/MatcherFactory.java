package com.strmatch.config;

import com.strmatch.exception.ConfigurationException;
import com.strmatch.matcher.AlwaysFalseMatcher;
import com.strmatch.matcher.AlwaysTrueMatcher;
import com.strmatch.matcher.EqualMatcher;
import com.strmatch.matcher.ListMatcher;
import com.strmatch.matcher.Matcher;
import com.strmatch.matcher.MatcherType;
import com.strmatch.matcher.PrefixMatcher;
import com.strmatch.matcher.RegexMatcher;
import com.strmatch.matcher.StringMatcher;
import com.strmatch.matcher.SubstringMatcher;

import java.util.List;

/**
 * Creates StringMatcher instances from configuration.
 */
public final class MatcherFactory {

    private MatcherFactory() {
    }

    /**
     * Build a matcher from its configuration.
     *
     * @param config Matcher configuration
     * @return Matcher holding the configured strategy
     * @throws ConfigurationException if required fields are missing
     * @throws com.strmatch.exception.InvalidPatternException if a REGEX pattern does not compile
     */
    public static StringMatcher create(MatcherConfig config) {
        if (config == null) {
            throw new ConfigurationException("Matcher configuration cannot be null");
        }

        MatcherType type = config.type();
        if (type == null) {
            throw new ConfigurationException("Matcher type cannot be null");
        }

        Matcher matcher = switch (type) {
            case ALWAYS_FALSE -> AlwaysFalseMatcher.INSTANCE;
            case ALWAYS_TRUE -> AlwaysTrueMatcher.INSTANCE;

            case EQUAL -> new EqualMatcher(requireValue(config));
            case PREFIX -> new PrefixMatcher(requireValue(config));
            case SUBSTRING -> new SubstringMatcher(requireValue(config));

            case REGEX -> RegexMatcher.compile(requirePattern(config));

            case LIST -> new ListMatcher(requireValues(config));
        };
        return StringMatcher.of(matcher);
    }

    // Validation helpers

    private static String requireValue(MatcherConfig config) {
        if (config.value() == null) {
            throw new ConfigurationException(config.type() + " matcher requires a value");
        }
        return config.value();
    }

    private static String requirePattern(MatcherConfig config) {
        if (config.pattern() == null || config.pattern().isEmpty()) {
            throw new ConfigurationException(config.type() + " matcher requires a pattern");
        }
        return config.pattern();
    }

    private static List<String> requireValues(MatcherConfig config) {
        if (config.values() == null) {
            throw new ConfigurationException(config.type() + " matcher requires a values list");
        }
        for (String v : config.values()) {
            if (v == null) {
                throw new ConfigurationException(config.type() + " matcher values cannot contain null");
            }
        }
        return config.values();
    }
}
