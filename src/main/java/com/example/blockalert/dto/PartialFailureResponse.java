package com.example.blockalert.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
public class PartialFailureResponse {
    private final ZonedDateTime timestamp;
    private final int status;
    private final String message;
    private final List<UUID> succeeded;
    private final List<String> failedReceivers;
    private final String path;
}
