package com.example.voter.exception;

/**
 * Failure of the backing store or of document (de)serialization.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
