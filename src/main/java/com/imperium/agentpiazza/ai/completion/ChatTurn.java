package com.imperium.agentpiazza.ai.completion;

import com.imperium.agentpiazza.model.entity.Message;

/**
 * 发给语言模型的一条历史消息。
 */
public record ChatTurn(String role, String content) {

    public static ChatTurn user(String content) {
        return new ChatTurn(Message.ROLE_USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Message.ROLE_ASSISTANT, content);
    }

    public static ChatTurn from(Message message) {
        return new ChatTurn(message.getRole(), message.getContent());
    }

    public boolean isAssistant() {
        return Message.ROLE_ASSISTANT.equals(role);
    }
}
