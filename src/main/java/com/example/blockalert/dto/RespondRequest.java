package com.example.blockalert.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RespondRequest {
    @NotBlank(message = "Response is required")
    private String response;
    private String responseMessage;
}
