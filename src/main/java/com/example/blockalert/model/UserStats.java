package com.example.blockalert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStats {
    private String userId;
    private long alertsSent;
    private long alertsReceived;
    private long carsFreed;
    private long situationsResolved;
}
