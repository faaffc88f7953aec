package io.ipamsync;

/**
 * Aborts a sync run. Raised to the caller of {@link SyncWorker#work} after the running
 * flag is cleared and every open handle is released.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
