package com.example.blockalert.model;

import com.example.blockalert.util.Constants.Tier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Per-user subscription tier and usage counter for the current quota window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntitlementState {
    private String userId;
    private Tier tier;
    private int dailyAlertsUsed;
    private ZonedDateTime usageWindowStart;
    private ZonedDateTime updatedAt;
}
