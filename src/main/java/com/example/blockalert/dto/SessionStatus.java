package com.example.blockalert.dto;

import com.example.blockalert.util.Constants.ConnectivityState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatus {
    private String sessionId;
    private String userId;
    private ConnectivityState connectivity;
    private EntitlementDecision entitlement;
    private Set<String> plateHashes;
    private AcknowledgmentSummary acknowledgments;
}
