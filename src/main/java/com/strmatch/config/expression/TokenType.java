package com.strmatch.config.expression;

/**
 * Token types for matcher expression parsing.
 */
public enum TokenType {
    // Literals
    STRING,
    BOOLEAN,

    // Delimiters
    LBRACKET,
    RBRACKET,
    COMMA,

    // Matcher keywords
    EQUAL,
    PREFIX,
    SUBSTRING,
    REGEX,
    IN,

    // Special
    EOF
}
