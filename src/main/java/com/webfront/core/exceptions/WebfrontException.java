package com.webfront.core.exceptions;

/**
 * Base exception for all webfront errors.
 */
public class WebfrontException extends RuntimeException {
    /**
     * Constructs a new WebfrontException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public WebfrontException(String message) {
        super(message);
    }

    /**
     * Constructs a new WebfrontException with the specified detail message and
     * cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public WebfrontException(String message, Throwable cause) {
        super(message, cause);
    }
}
