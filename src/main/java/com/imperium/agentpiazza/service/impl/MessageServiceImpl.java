package com.imperium.agentpiazza.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.agentpiazza.mapper.MessageMapper;
import com.imperium.agentpiazza.model.entity.Message;
import com.imperium.agentpiazza.service.MessageService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class MessageServiceImpl extends ServiceImpl<MessageMapper, Message> implements MessageService {

    @Override
    public List<Message> listByConversation(String conversationId) {
        return lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByAsc(Message::getCreatedAt)
                .orderByAsc(Message::getSeq)
                .list();
    }

    @Override
    @Transactional
    public List<Message> appendTurn(String conversationId, String userContent, String assistantContent) {
        LocalDateTime now = LocalDateTime.now();
        Message user = newMessage(conversationId, Message.ROLE_USER, userContent, now);
        Message assistant = newMessage(conversationId, Message.ROLE_ASSISTANT, assistantContent, now);
        save(user);
        save(assistant);
        return List.of(user, assistant);
    }

    @Override
    public Message appendAssistant(String conversationId, String content) {
        Message assistant = newMessage(conversationId, Message.ROLE_ASSISTANT, content, LocalDateTime.now());
        save(assistant);
        return assistant;
    }

    @Override
    public void deleteByConversation(String conversationId) {
        lambdaUpdate().eq(Message::getConversationId, conversationId).remove();
    }

    private static Message newMessage(String conversationId, String role, String content, LocalDateTime createdAt) {
        Message message = new Message();
        message.setId("msg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        message.setConversationId(conversationId);
        message.setRole(role);
        message.setContent(content != null ? content : "");
        message.setCreatedAt(createdAt);
        return message;
    }
}
