package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.ai.completion.ChatTurn;
import com.imperium.agentpiazza.ai.completion.CompletionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class CompletionServiceImplTest {

    private static final List<ChatTurn> HISTORY = List.of(ChatTurn.user("hi"));

    private ChatClient chatClient;

    @BeforeEach
    void setUp() {
        chatClient = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
    }

    @Test
    void returnsModelText() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).call().content()).thenReturn("hello there");
        CompletionServiceImpl service = new CompletionServiceImpl(chatClient, Duration.ofSeconds(5));

        CompletionResult result = service.complete(HISTORY, "be brief");

        assertTrue(result.isSuccess());
        assertEquals("hello there", result.text());
    }

    @Test
    void connectionRefusedIsUnavailable() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).call().content())
                .thenThrow(new ResourceAccessException("I/O error on POST", new ConnectException("Connection refused")));
        CompletionServiceImpl service = new CompletionServiceImpl(chatClient, Duration.ofSeconds(5));

        CompletionResult result = service.complete(HISTORY, "sys");

        assertEquals(CompletionResult.Status.UNAVAILABLE, result.status());
        assertEquals(CompletionResult.UNAVAILABLE_MESSAGE, result.text());
    }

    @Test
    void slowModelTimesOut() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).call().content()).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return "too late";
        });
        CompletionServiceImpl service = new CompletionServiceImpl(chatClient, Duration.ofMillis(100));

        CompletionResult result = service.complete(HISTORY, "sys");

        assertEquals(CompletionResult.Status.TIMEOUT, result.status());
        assertEquals(CompletionResult.TIMEOUT_MESSAGE, result.text());
    }

    @Test
    void interruptedCallerKeepsInterruptFlag() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).call().content()).thenAnswer(inv -> {
            Thread.sleep(1_000);
            return "late";
        });
        CompletionServiceImpl service = new CompletionServiceImpl(chatClient, Duration.ofSeconds(5));

        Thread.currentThread().interrupt();
        CompletionResult result = service.complete(HISTORY, "sys");

        assertTrue(Thread.interrupted());
        assertEquals(CompletionResult.Status.ERROR, result.status());
    }

    @Test
    void isInterruptLooksThroughWrappers() {
        assertTrue(CompletionServiceImpl.isInterrupt(new RuntimeException(new InterruptedException())));
        assertFalse(CompletionServiceImpl.isInterrupt(new IllegalStateException("boom")));
    }

    @Test
    void otherFailuresAreTaggedAsError() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).call().content())
                .thenThrow(new IllegalArgumentException("model not found"));
        CompletionServiceImpl service = new CompletionServiceImpl(chatClient, Duration.ofSeconds(5));

        CompletionResult result = service.complete(HISTORY, "sys");

        assertEquals(CompletionResult.Status.ERROR, result.status());
        assertTrue(result.text().contains("model not found"));
    }

    @Test
    void classifyFollowsCauseChain() {
        assertEquals(CompletionResult.Status.TIMEOUT,
                CompletionServiceImpl.classify(new RuntimeException(new SocketTimeoutException("read timed out"))));
        assertEquals(CompletionResult.Status.TIMEOUT, CompletionServiceImpl.classify(new TimeoutException()));
        assertEquals(CompletionResult.Status.UNAVAILABLE,
                CompletionServiceImpl.classify(new IllegalStateException(new ConnectException("refused"))));
        assertEquals(CompletionResult.Status.ERROR, CompletionServiceImpl.classify(new IllegalStateException("boom")));
    }

    @Test
    void historyRolesMapToSpringAiMessages() {
        List<Message> messages = CompletionServiceImpl.toMessages(List.of(
                ChatTurn.user("q"), ChatTurn.assistant("a"), new ChatTurn("user", null)));

        assertInstanceOf(UserMessage.class, messages.get(0));
        assertInstanceOf(AssistantMessage.class, messages.get(1));
        assertEquals("", messages.get(2).getText());
    }
}
