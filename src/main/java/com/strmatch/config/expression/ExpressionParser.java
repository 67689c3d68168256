package com.strmatch.config.expression;

import com.strmatch.config.MatcherConfig;
import com.strmatch.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for matcher expressions.
 * Converts tokens into a MatcherConfig.
 * <p>
 * Grammar:
 * <pre>
 * expression := 'TRUE' | 'FALSE'
 *             | string | 'EQUAL' string
 *             | 'PREFIX' string | 'SUBSTRING' string
 *             | 'REGEX' string
 *             | 'IN' '[' (string (',' string)*)? ']'
 * </pre>
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a MatcherConfig.
     *
     * @return Matcher configuration
     */
    public MatcherConfig parse() {
        MatcherConfig result = parseMatcher();
        expect(TokenType.EOF);
        return result;
    }

    private MatcherConfig parseMatcher() {
        Token token = advance();
        return switch (token.type()) {
            case BOOLEAN -> Boolean.TRUE.equals(token.literal())
                    ? MatcherConfig.alwaysTrue()
                    : MatcherConfig.alwaysFalse();
            case STRING -> MatcherConfig.equal((String) token.literal());
            case EQUAL -> MatcherConfig.equal(parseString());
            case PREFIX -> MatcherConfig.prefix(parseString());
            case SUBSTRING -> MatcherConfig.substring(parseString());
            case REGEX -> MatcherConfig.regex(parseString());
            case IN -> MatcherConfig.list(parseList());
            default -> throw error("Expected a matcher but found " + describe(token), token);
        };
    }

    private List<String> parseList() {
        expect(TokenType.LBRACKET);
        List<String> values = new ArrayList<>();
        if (match(TokenType.RBRACKET)) {
            return values;
        }
        do {
            values.add(parseString());
        } while (match(TokenType.COMMA));
        expect(TokenType.RBRACKET);
        return values;
    }

    private String parseString() {
        Token token = expect(TokenType.STRING);
        return (String) token.literal();
    }

    private boolean match(TokenType type) {
        if (peek().type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (token.type() != type) {
            throw error("Expected " + type + " but found " + describe(token), token);
        }
        index++;
        return token;
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
    }

    private ConfigurationException error(String message, Token token) {
        return new ConfigurationException("Invalid matcher-expr at position "
                + token.position() + ": " + message + " in '" + input + "'");
    }
}
