package com.example.voter.exception;

/**
 * Voter body that parsed as JSON but cannot be stored; mapped to 400.
 */
public class InvalidVoterException extends RuntimeException {
    public InvalidVoterException(String message) {
        super(message);
    }
}
