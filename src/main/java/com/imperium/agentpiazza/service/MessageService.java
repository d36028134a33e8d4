package com.imperium.agentpiazza.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.agentpiazza.model.entity.Message;

import java.util.List;

/**
 * 消息服务，用于加载/追加会话消息。
 */
public interface MessageService extends IService<Message> {

    /** 按创建顺序返回 */
    List<Message> listByConversation(String conversationId);

    /**
     * 在同一事务内追加一条 user 消息和一条 assistant 消息。
     *
     * @return 按顺序的两条消息
     */
    List<Message> appendTurn(String conversationId, String userContent, String assistantContent);

    Message appendAssistant(String conversationId, String content);

    void deleteByConversation(String conversationId);
}
