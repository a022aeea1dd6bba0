package com.example.blockalert.dto;

import com.example.blockalert.util.Constants.Tier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntitlementDecision {
    private boolean allowed;
    private int remaining;
    private int dailyQuota;
    private Tier tier;
    private String reason;

    public boolean isPremium() {
        return tier != null && tier.isPremium();
    }
}
