package com.example.blockalert.exception;

import lombok.Getter;

/**
 * Raised when a quota or limit is exhausted. No alert row has been written.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final int limit;

    public RateLimitExceededException(String message, int limit) {
        super(message);
        this.limit = limit;
    }
}
