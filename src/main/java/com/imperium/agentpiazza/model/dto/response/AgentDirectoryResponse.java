package com.imperium.agentpiazza.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentDirectoryResponse {

    private List<AgentProfileResponse> agents;
    private int total;
}
