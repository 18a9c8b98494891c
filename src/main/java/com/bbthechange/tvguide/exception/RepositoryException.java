package com.bbthechange.tvguide.exception;

/**
 * Exception thrown when persisted state cannot be written.
 * Wraps lower-level I/O exceptions with meaningful messages.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
