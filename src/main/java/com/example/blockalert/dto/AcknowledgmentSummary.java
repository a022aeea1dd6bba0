package com.example.blockalert.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sender-side view of alerts still waiting for an acknowledged answer, plus the receiver-side
 * count of alerts the user has not answered yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgmentSummary {
    private long pending;
    private long timedOut;
    private long acknowledged;
    private long unansweredReceived;

    public long getUnacknowledged() {
        return pending + timedOut;
    }
}
