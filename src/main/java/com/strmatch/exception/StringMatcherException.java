package com.strmatch.exception;

/**
 * Base exception for the string matcher library.
 */
public class StringMatcherException extends RuntimeException {

    public StringMatcherException(String message) {
        super(message);
    }

    public StringMatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
