package com.example.blockalert.model;

import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * An alert change waiting to be relayed to Kafka. Written in the same transaction as the alert row.
 */
@Data
@Builder
public class OutboxEvent {
    private UUID id;
    private UUID alertId;
    private String eventType;
    private String topic;
    private String messageKey;
    private String payload;
    private ZonedDateTime createdAt;
}
