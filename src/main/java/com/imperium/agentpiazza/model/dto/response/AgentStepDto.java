package com.imperium.agentpiazza.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对话处理步骤，供前端展示进度。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentStepDto {

    public static final String DONE = "done";
    public static final String ACTIVE = "active";
    public static final String FAILED = "failed";

    private String label;

    /** done | active | failed */
    private String status;

    public static AgentStepDto done(String label) {
        return new AgentStepDto(label, DONE);
    }

    public static AgentStepDto active(String label) {
        return new AgentStepDto(label, ACTIVE);
    }

    public static AgentStepDto failed(String label) {
        return new AgentStepDto(label, FAILED);
    }
}
