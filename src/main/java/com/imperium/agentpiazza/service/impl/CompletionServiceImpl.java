package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.ai.completion.ChatTurn;
import com.imperium.agentpiazza.ai.completion.CompletionResult;
import com.imperium.agentpiazza.service.CompletionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI {@link ChatClient} 的阻塞补全。
 * 调用在 boundedElastic 上执行并受 {@code app.chat.completion-timeout} 约束，超时即取消。
 */
@Service
public class CompletionServiceImpl implements CompletionService {

    private static final Logger log = LoggerFactory.getLogger(CompletionServiceImpl.class);

    private final ChatClient chatClient;
    private final Duration timeout;

    public CompletionServiceImpl(ChatClient chatClient,
                                 @Value("${app.chat.completion-timeout:120s}") Duration timeout) {
        this.chatClient = chatClient;
        this.timeout = timeout;
    }

    @Override
    public CompletionResult complete(List<ChatTurn> history, String systemPrompt) {
        List<org.springframework.ai.chat.messages.Message> messages = toMessages(history);
        try {
            String text = Mono.fromCallable(() -> chatClient.prompt()
                            .system(systemPrompt != null ? systemPrompt : "")
                            .messages(messages)
                            .call()
                            .content())
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
            return CompletionResult.ok(text);
        } catch (Exception e) {
            if (isInterrupt(e)) {
                Thread.currentThread().interrupt();
            }
            CompletionResult.Status status = classify(e);
            log.warn("Completion failed ({}): {}", status, e.getMessage());
            return switch (status) {
                case UNAVAILABLE -> CompletionResult.unavailable();
                case TIMEOUT -> CompletionResult.timeout();
                default -> CompletionResult.error(rootMessage(e));
            };
        }
    }

    static List<org.springframework.ai.chat.messages.Message> toMessages(List<ChatTurn> history) {
        List<org.springframework.ai.chat.messages.Message> out = new ArrayList<>();
        if (history == null) {
            return out;
        }
        for (ChatTurn turn : history) {
            String content = turn.content() != null ? turn.content() : "";
            if (turn.isAssistant()) {
                out.add(new AssistantMessage(content));
            } else {
                out.add(new UserMessage(content));
            }
        }
        return out;
    }

    /**
     * 沿 cause 链判断失败原因：连接类错误视为不可用，超时类视为超时。
     */
    static CompletionResult.Status classify(Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while (current != null) {
            if (current instanceof TimeoutException || current instanceof SocketTimeoutException) {
                return CompletionResult.Status.TIMEOUT;
            }
            if (current instanceof ConnectException || current instanceof UnknownHostException) {
                return CompletionResult.Status.UNAVAILABLE;
            }
            if (current instanceof ResourceAccessException && current.getCause() == null) {
                return CompletionResult.Status.UNAVAILABLE;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return CompletionResult.Status.ERROR;
    }

    static boolean isInterrupt(Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while (current != null) {
            if (current instanceof InterruptedException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
