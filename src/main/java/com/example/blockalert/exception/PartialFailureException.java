package com.example.blockalert.exception;

import lombok.Getter;

import java.util.List;
import java.util.UUID;

/**
 * Fan-out reached some owners but not all. The written alerts stay; the failed receivers can be
 * retried individually.
 */
@Getter
public class PartialFailureException extends RuntimeException {

    private final List<UUID> succeeded;
    private final List<String> failedReceivers;

    public PartialFailureException(List<UUID> succeeded, List<String> failedReceivers) {
        super(String.format("Alert delivered to %d of %d owners", succeeded.size(), succeeded.size() + failedReceivers.size()));
        this.succeeded = List.copyOf(succeeded);
        this.failedReceivers = List.copyOf(failedReceivers);
    }
}
