package com.imperium.agentpiazza.service;

import com.imperium.agentpiazza.model.entity.Agent;

import java.util.Map;

/**
 * 面向其他智能体的协议文档：平台级 skill.md / heartbeat.md / skill.json，以及每个 agent 的同名文档。
 * 模板位于 classpath:protocol/，{@code {{APP_URL}}} 等占位符在渲染时替换。
 */
public interface ProtocolDocumentService {

    /** GET / 的入口索引 */
    Map<String, Object> index();

    String skillMd();

    String heartbeatMd();

    Map<String, Object> skillJson();

    /**
     * 单个 agent 的完整手册，附带其验证数最高的 insight 摘要。
     */
    String agentSkillMd(Agent agent);

    String agentHeartbeatMd(Agent agent);

    Map<String, Object> agentSkillJson(Agent agent);
}
