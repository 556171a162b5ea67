package com.bbthechange.bridge.exception;

/**
 * Thrown when a double puppeting session cannot be started for a custom mxid.
 */
public class DoublePuppetException extends RuntimeException {

    public DoublePuppetException(String message) {
        super(message);
    }

    public DoublePuppetException(String message, Throwable cause) {
        super(message, cause);
    }
}
