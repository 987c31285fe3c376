package com.example.voter.exception;

public class DuplicatePollException extends RuntimeException {
    public DuplicatePollException(int voterId, int pollId) {
        super("Voter " + voterId + " already has history for poll " + pollId);
    }
}
