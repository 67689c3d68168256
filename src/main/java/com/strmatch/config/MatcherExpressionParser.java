package com.strmatch.config;

import com.strmatch.config.expression.ExpressionParser;
import com.strmatch.config.expression.ExpressionTokenizer;
import com.strmatch.config.expression.Token;
import com.strmatch.exception.ConfigurationException;

import java.util.List;

/**
 * Facade for parsing matcher expressions into MatcherConfig.
 * <p>
 * Supports:
 * <ul>
 *   <li>Constants: TRUE, FALSE</li>
 *   <li>Text: 'value' (exact), EQUAL 'value', PREFIX 'value', SUBSTRING 'value'</li>
 *   <li>Pattern: REGEX '^res.*ial$'</li>
 *   <li>Collection: IN ['a', 'b']</li>
 * </ul>
 * Keywords are case-insensitive; STARTS_WITH and CONTAINS are accepted as
 * aliases of PREFIX and SUBSTRING.
 */
public final class MatcherExpressionParser {

    private MatcherExpressionParser() {
    }

    /**
     * Parse a matcher expression.
     *
     * @param expression Expression string
     * @return Parsed matcher configuration
     * @throws ConfigurationException if the expression is blank or malformed
     */
    public static MatcherConfig parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Matcher expression cannot be blank");
        }

        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        ExpressionParser parser = new ExpressionParser(expression, tokens);
        return parser.parse();
    }
}
