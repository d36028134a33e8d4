package com.imperium.agentpiazza.service;

import com.imperium.agentpiazza.ai.completion.ChatTurn;
import com.imperium.agentpiazza.ai.completion.CompletionResult;

import java.util.List;

/**
 * 语言模型补全。永不抛出：连接失败、超时等都以 {@link CompletionResult} 的失败状态返回，
 * 并附带可直接展示给用户的说明文本。
 */
public interface CompletionService {

    CompletionResult complete(List<ChatTurn> history, String systemPrompt);
}
