package com.strmatch.config.expression;

import java.util.Map;

/**
 * Keywords and operator characters of the matcher expression syntax.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords mapped to token types. Lookup is done on the upper-cased word.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("EQUAL", TokenType.EQUAL),
            Map.entry("EQUALS", TokenType.EQUAL),
            Map.entry("PREFIX", TokenType.PREFIX),
            Map.entry("STARTS_WITH", TokenType.PREFIX),
            Map.entry("SUBSTRING", TokenType.SUBSTRING),
            Map.entry("CONTAINS", TokenType.SUBSTRING),
            Map.entry("REGEX", TokenType.REGEX),
            Map.entry("IN", TokenType.IN),

            // Literals
            Map.entry("TRUE", TokenType.BOOLEAN),
            Map.entry("FALSE", TokenType.BOOLEAN)
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "TRUE", true,
            "FALSE", false
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
