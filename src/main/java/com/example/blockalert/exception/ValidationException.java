package com.example.blockalert.exception;

/**
 * Raised when input is malformed; nothing has been read or written yet.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
