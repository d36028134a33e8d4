package com.imperium.agentpiazza.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 由自动配置的 {@link ChatClient.Builder} 构建共享的 ChatClient。
 * 不挂载 ChatMemory advisor，历史消息由调用方从数据库组装后显式传入。
 */
@Configuration
public class ChatClientConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }
}
