package com.imperium.agentpiazza.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.agentpiazza.mapper.ConversationMapper;
import com.imperium.agentpiazza.model.entity.Conversation;
import com.imperium.agentpiazza.service.ConversationService;
import com.imperium.agentpiazza.service.MessageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation> implements ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationServiceImpl.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final MessageService messageService;

    public ConversationServiceImpl(MessageService messageService) {
        this.messageService = messageService;
    }

    @Override
    public Optional<Conversation> findBySession(String agentId, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lambdaQuery()
                .eq(Conversation::getAgentId, agentId)
                .eq(Conversation::getSessionId, sessionId)
                .last("LIMIT 1")
                .one());
    }

    @Override
    public Conversation getOrCreate(String agentId, String sessionId) {
        Optional<Conversation> existing = findBySession(agentId, sessionId);
        if (existing.isPresent()) {
            return existing.get();
        }

        String resolvedSessionId = (sessionId == null || sessionId.isBlank()) ? newSessionId() : sessionId;
        Conversation conversation = new Conversation();
        conversation.setId("c_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        conversation.setAgentId(agentId);
        conversation.setSessionId(resolvedSessionId);
        conversation.setCreatedAt(LocalDateTime.now());
        try {
            save(conversation);
            return conversation;
        } catch (DuplicateKeyException e) {
            // 并发的首条消息：唯一约束 (agent_id, session_id) 保证只有一行，读回已存在的那一行
            log.debug("Conversation already created concurrently: agentId={}, sessionId={}", agentId, resolvedSessionId);
            return findBySession(agentId, resolvedSessionId).orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional
    public boolean deleteWithMessages(String agentId, String sessionId) {
        Optional<Conversation> conversation = findBySession(agentId, sessionId);
        if (conversation.isEmpty()) {
            return false;
        }
        String conversationId = conversation.get().getId();
        messageService.deleteByConversation(conversationId);
        removeById(conversationId);
        log.info("Conversation cleared: agentId={}, conversationId={}", agentId, conversationId);
        return true;
    }

    /** URL 安全的随机会话令牌（16 字节） */
    static String newSessionId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
