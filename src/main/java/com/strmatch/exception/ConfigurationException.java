package com.strmatch.exception;

/**
 * Exception thrown when matcher configuration is invalid.
 * Results in fail-fast at load time.
 */
public class ConfigurationException extends StringMatcherException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
