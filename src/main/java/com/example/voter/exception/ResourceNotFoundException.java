package com.example.voter.exception;

/**
 * Base for lookups that matched nothing; mapped to 404.
 */
public abstract class ResourceNotFoundException extends RuntimeException {
    protected ResourceNotFoundException(String message) {
        super(message);
    }
}
