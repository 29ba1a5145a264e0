package com.example.shiftplanner.client;

/**
 * The server could not be reached. Always retryable.
 */
public class NetworkException extends PersistenceException {

    public NetworkException(String message, Throwable cause) {
        super(PersistenceError.network(message), cause);
    }
}
