package com.example.blockalert.model;

import com.example.blockalert.util.Constants.MarkerStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgmentMarker {
    private String ownerId;
    private UUID alertId;
    private MarkerStatus status;
    private ZonedDateTime createdAt;
    private ZonedDateTime acknowledgedAt;
}
