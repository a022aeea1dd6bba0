package com.example.blockalert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlateRegistration {
    private Long id;
    private String userId;
    private String plateHash;
    private ZonedDateTime createdAt;
}
