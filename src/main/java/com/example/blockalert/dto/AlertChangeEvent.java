package com.example.blockalert.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Notification that an alert row changed. Consumers reload the row; the event carries no state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertChangeEvent {
    private String eventId;
    private UUID alertId;
    private String senderId;
    private String receiverId;
    private String eventType;
    private String podId;
    private ZonedDateTime timestamp;
}
