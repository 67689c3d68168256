package com.strmatch.config.expression;

import com.strmatch.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.strmatch.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for matcher expressions.
 * Converts input string into a sequence of tokens.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always ending with EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_BRACKET -> {
                    advance();
                    tokens.add(new Token(TokenType.LBRACKET, "[", null, start));
                }
                case Operators.RIGHT_BRACKET -> {
                    advance();
                    tokens.add(new Token(TokenType.RBRACKET, "]", null, start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isKeywordStart(c)) {
                        tokens.add(readKeyword());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readKeyword() {
        int start = pos;

        while (!isAtEnd() && isKeywordPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String upper = text.toUpperCase(Locale.ROOT);

        TokenType keywordType = KEYWORDS.get(upper);
        if (keywordType == null) {
            throw error("Unknown keyword '" + text + "' (quote plain values)", start);
        }
        Object literal = null;
        if (keywordType == TokenType.BOOLEAN) {
            literal = BOOLEAN_VALUES.get(upper);
        }
        return new Token(keywordType, text, literal, start);
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
    }

    private boolean isKeywordStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isKeywordPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException("Invalid matcher-expr at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
