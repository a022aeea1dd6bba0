package com.example.blockalert.exception;

/**
 * Transient transport failure. Callers retry with backoff; nothing here retries on their behalf.
 */
public class NetworkUnavailableException extends RuntimeException {
    public NetworkUnavailableException(String message) {
        super(message);
    }

    public NetworkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
