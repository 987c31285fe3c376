package com.example.voter.exception;

public class PollNotFoundException extends ResourceNotFoundException {
    public PollNotFoundException(int voterId, int pollId) {
        super("Voter " + voterId + " has no history for poll " + pollId);
    }
}
