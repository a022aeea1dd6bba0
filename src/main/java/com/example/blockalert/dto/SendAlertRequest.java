package com.example.blockalert.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either the raw plate text or an already computed fingerprint identifies the target vehicle.
 * The raw plate is hashed on arrival and never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendAlertRequest {
    @NotBlank(message = "Sender ID is required")
    private String senderId;
    private String plate;
    private String plateHash;
    private String message;
    private String urgency;
    private String sessionId;

    @AssertTrue(message = "Either plate or plateHash is required")
    public boolean isTargetPresent() {
        return (plate != null && !plate.isBlank()) || (plateHash != null && !plateHash.isBlank());
    }
}
