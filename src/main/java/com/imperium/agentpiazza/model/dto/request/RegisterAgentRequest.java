package com.imperium.agentpiazza.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RegisterAgentRequest {

    @NotBlank(message = "name is required")
    @Size(min = 2, max = 120, message = "name length must be 2~120")
    private String name;

    @NotBlank(message = "description is required")
    @Size(min = 5, message = "description must be at least 5 characters")
    private String description;
}
