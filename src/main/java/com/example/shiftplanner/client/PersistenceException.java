package com.example.shiftplanner.client;

/**
 * Failure of a client persistence call. The attached {@link PersistenceError} is what
 * error subscribers receive.
 */
public class PersistenceException extends RuntimeException {

    private final PersistenceError error;

    public PersistenceException(PersistenceError error) {
        super(error.message());
        this.error = error;
    }

    public PersistenceException(PersistenceError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public PersistenceException(PersistenceError.Type type, String message, boolean retryable) {
        this(new PersistenceError(type, message, null, retryable));
    }

    public PersistenceError getError() {
        return error;
    }

    public boolean isRetryable() {
        return error.retryable();
    }
}
