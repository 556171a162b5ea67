package com.bbthechange.bridge.exception;

/**
 * Thrown when a remote avatar image could not be downloaded.
 */
public class AvatarFetchException extends RuntimeException {

    private final String url;
    private final Integer statusCode;

    public AvatarFetchException(String url, int statusCode) {
        super("Couldn't download profile picture from " + url + ": HTTP " + statusCode);
        this.url = url;
        this.statusCode = statusCode;
    }

    public AvatarFetchException(String url, Throwable cause) {
        super("Couldn't download profile picture from " + url, cause);
        this.url = url;
        this.statusCode = null;
    }

    public String getUrl() {
        return url;
    }

    /**
     * HTTP status of the failed download, or null if no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
