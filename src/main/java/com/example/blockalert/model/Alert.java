package com.example.blockalert.model;

import com.example.blockalert.util.Constants.UrgencyLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * One notification from one sender to one receiver about one plate.
 * Only the read and response fields change after insert.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private UUID id;
    private String senderId;
    private String receiverId;
    private String plateHash;
    private String message;
    @Builder.Default
    private UrgencyLevel urgency = UrgencyLevel.NORMAL;
    private AlertResponse response;
    private String responseMessage;
    private ZonedDateTime createdAt;
    private ZonedDateTime readAt;
    private ZonedDateTime respondedAt;
    private boolean pushSent;
    private ZonedDateTime pushSentAt;

    public boolean isRead() {
        return readAt != null;
    }

    public boolean isResponded() {
        return response != null && respondedAt != null;
    }
}
