package com.bbthechange.bridge.exception;

/**
 * Exception thrown when the homeserver rejects a request made on behalf of a ghost user.
 * Carries the HTTP status and the Matrix error code when the homeserver returned one.
 */
public class MatrixRequestException extends RuntimeException {

    private final int statusCode;
    private final String errcode;

    public MatrixRequestException(int statusCode, String errcode, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errcode = errcode;
    }

    public MatrixRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.errcode = null;
    }

    /**
     * HTTP status code, or -1 when the request never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getErrcode() {
        return errcode;
    }

    public boolean hasErrcode(String code) {
        return code.equals(errcode);
    }
}
