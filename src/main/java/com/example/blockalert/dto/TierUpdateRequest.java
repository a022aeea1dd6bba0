package com.example.blockalert.dto;

import com.example.blockalert.util.Constants.Tier;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TierUpdateRequest {
    @NotNull(message = "Tier is required")
    private Tier tier;
}
