package com.example.blockalert.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterPlateRequest {
    @NotBlank(message = "User ID is required")
    private String userId;
    @NotBlank(message = "Plate is required")
    private String plate;
}
