package com.example.voter.exception;

public class VoterAlreadyExistsException extends RuntimeException {
    public VoterAlreadyExistsException(int voterId) {
        super("Voter " + voterId + " already exists");
    }
}
