package io.ipamsync.clients;

/**
 * Exception thrown when a call to an external API fails.
 * Status code is the HTTP status, or 0 when no response was received (connect error, timeout).
 */
public class ApiException extends Exception {

    public static final int NO_RESPONSE = 0;
    private static final int NOT_FOUND = 404;

    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == NOT_FOUND;
    }
}
