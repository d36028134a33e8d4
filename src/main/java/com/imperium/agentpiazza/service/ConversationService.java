package com.imperium.agentpiazza.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.agentpiazza.model.entity.Conversation;

import java.util.Optional;

/**
 * 会话服务：按 (agentId, sessionId) 定位会话。
 */
public interface ConversationService extends IService<Conversation> {

    Optional<Conversation> findBySession(String agentId, String sessionId);

    /**
     * 取已有会话，或懒创建。sessionId 为空时由服务端生成。
     */
    Conversation getOrCreate(String agentId, String sessionId);

    /**
     * 删除会话及其全部消息；会话不存在时返回 false。
     */
    boolean deleteWithMessages(String agentId, String sessionId);
}
