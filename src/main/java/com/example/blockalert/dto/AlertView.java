package com.example.blockalert.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Wire representation of an alert, used for HTTP bodies and SSE payloads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertView {
    private UUID id;
    private String senderId;
    private String receiverId;
    private String plateHash;
    private String message;
    private String urgency;
    private String response;
    private String responseText;
    private String responseMessage;
    private ZonedDateTime createdAt;
    private ZonedDateTime readAt;
    private ZonedDateTime respondedAt;
}
