package com.example.voter.exception;

public class VoterNotFoundException extends ResourceNotFoundException {
    public VoterNotFoundException(int voterId) {
        super("Voter " + voterId + " does not exist");
    }
}
