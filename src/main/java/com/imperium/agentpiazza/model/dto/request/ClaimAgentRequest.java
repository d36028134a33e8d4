package com.imperium.agentpiazza.model.dto.request;

import jakarta.validation.constraints.Email;
import lombok.Data;

@Data
public class ClaimAgentRequest {

    @Email(message = "owner_email must be a valid email")
    private String ownerEmail;
}
