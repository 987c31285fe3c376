package com.example.voter.controller;

import com.example.voter.exception.DuplicatePollException;
import com.example.voter.exception.InvalidVoterException;
import com.example.voter.exception.ResourceNotFoundException;
import com.example.voter.exception.StoreException;
import com.example.voter.exception.VoterAlreadyExistsException;
import com.example.voter.service.ApiStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to bare status codes. Callers never get an error body.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class VoterExceptionHandler {

    private final ApiStats apiStats;

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Void> badPathVariable(MethodArgumentTypeMismatchException e) {
        log.warn("Malformed path variable '{}': {}", e.getName(), e.getValue());
        return status(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Void> badBody(HttpMessageNotReadableException e) {
        log.warn("Error binding JSON: {}", e.getMostSpecificCause().getMessage());
        return status(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Void> unsupportedBody(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported request body type: {}", e.getContentType());
        return status(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidVoterException.class)
    public ResponseEntity<Void> invalidVoter(InvalidVoterException e) {
        log.warn(e.getMessage());
        return status(HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Void> notFound(ResourceNotFoundException e) {
        log.warn(e.getMessage());
        return status(HttpStatus.NOT_FOUND);
    }

    // duplicates stay internal errors, matching the original service
    @ExceptionHandler({VoterAlreadyExistsException.class, DuplicatePollException.class})
    public ResponseEntity<Void> duplicate(RuntimeException e) {
        log.warn(e.getMessage());
        return status(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Void> storeFailure(StoreException e) {
        log.error("Store failure: {}", e.getMessage(), e);
        return status(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Void> unexpected(RuntimeException e) {
        log.error("Unexpected failure", e);
        return status(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Void> status(HttpStatus status) {
        apiStats.recordError();
        return ResponseEntity.status(status).build();
    }
}
