package com.bbthechange.bridge.exception;

/**
 * Thrown when the puppet store cannot be read or written.
 * Wraps the underlying DynamoDB exception; callers of the registry are expected to let it propagate.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
