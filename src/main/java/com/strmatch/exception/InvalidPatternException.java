package com.strmatch.exception;

/**
 * Exception thrown when a regular expression cannot be compiled.
 * Raised while the regex matcher is being built, so no matcher exists afterwards.
 */
public class InvalidPatternException extends StringMatcherException {

    private final String pattern;

    public InvalidPatternException(String pattern, Throwable cause) {
        super("Invalid regular expression '" + pattern + "': " + cause.getMessage(), cause);
        this.pattern = pattern;
    }

    /**
     * Get the pattern text that failed to compile.
     */
    public String getPattern() {
        return pattern;
    }
}
