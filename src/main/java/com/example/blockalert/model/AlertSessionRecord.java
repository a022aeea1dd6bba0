package com.example.blockalert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Presence row for a live session, used cluster-wide to decide whether a receiver needs a push.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSessionRecord {
    private String sessionId;
    private String userId;
    private String podId;
    private String connectionStatus;
    private ZonedDateTime connectedAt;
    private ZonedDateTime lastHeartbeat;
    private ZonedDateTime disconnectedAt;
}
