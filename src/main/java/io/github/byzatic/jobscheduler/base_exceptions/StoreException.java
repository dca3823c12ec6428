package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * Job set could not be loaded from or written to a {@code JobStore}.
 */
public class StoreException extends Exception {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(Throwable cause) {
        super(cause);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(Throwable cause, String message) {
        super(message, cause);
    }
}
