package com.imperium.agentpiazza.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.agentpiazza.model.entity.Agent;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Agent 注册、认领与 Bearer 认证。
 */
public interface AgentService extends IService<Agent> {

    /**
     * @throws com.imperium.agentpiazza.exception.NotFoundException agent 不存在
     */
    Agent requireById(String agentId);

    /**
     * 解析 {@code Authorization: Bearer <api_key>}，并刷新 last_active。
     *
     * @throws com.imperium.agentpiazza.exception.UnauthorizedException 缺失或无效
     */
    Agent authenticate(String authorizationHeader);

    Optional<Agent> findByApiKey(String apiKey);

    boolean isNameTaken(String name);

    void touchLastActive(String agentId, LocalDateTime at);

    /**
     * @throws com.imperium.agentpiazza.exception.ConflictException 名称已被占用（含并发注册撞唯一约束）
     */
    Agent register(String name, String description);

    Agent claim(String claimToken, String ownerEmail);

    List<Agent> listRecent(int limit, int offset);
}
