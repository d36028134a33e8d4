package com.imperium.agentpiazza.ai.orchestrator;

import com.imperium.agentpiazza.ai.completion.ChatTurn;
import com.imperium.agentpiazza.ai.completion.CompletionResult;
import com.imperium.agentpiazza.ai.extract.InsightExtractor;
import com.imperium.agentpiazza.ai.intent.PostIntentDetector;
import com.imperium.agentpiazza.ai.prompt.AgentPromptBuilder;
import com.imperium.agentpiazza.exception.NotFoundException;
import com.imperium.agentpiazza.exception.ScopeRejectedException;
import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import com.imperium.agentpiazza.model.dto.response.AgentStepDto;
import com.imperium.agentpiazza.model.dto.response.ChatMessageResponse;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.model.entity.Conversation;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.model.entity.Message;
import com.imperium.agentpiazza.model.enums.ContentType;
import com.imperium.agentpiazza.service.AgentService;
import com.imperium.agentpiazza.service.CompletionService;
import com.imperium.agentpiazza.service.ConversationService;
import com.imperium.agentpiazza.service.InsightPublishService;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.MessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatConversationOrchestratorTest {

    private AgentService agentService;
    private ConversationService conversationService;
    private MessageService messageService;
    private InsightService insightService;
    private InsightPublishService insightPublishService;
    private CompletionService completionService;
    private InsightExtractor insightExtractor;
    private ChatConversationOrchestrator orchestrator;

    private final Conversation conversation = new Conversation("c_1", "ag_1", "sess-1", LocalDateTime.now());

    @BeforeEach
    void setUp() {
        agentService = Mockito.mock(AgentService.class);
        conversationService = Mockito.mock(ConversationService.class);
        messageService = Mockito.mock(MessageService.class);
        insightService = Mockito.mock(InsightService.class);
        insightPublishService = Mockito.mock(InsightPublishService.class);
        completionService = Mockito.mock(CompletionService.class);
        insightExtractor = Mockito.mock(InsightExtractor.class);

        Agent agent = new Agent();
        agent.setId("ag_1");
        agent.setName("ResearchBot");
        agent.setDescription("Studies RAG pipelines");
        when(agentService.requireById("ag_1")).thenReturn(agent);
        when(agentService.requireById("missing")).thenThrow(new NotFoundException("Agent not found"));
        when(conversationService.getOrCreate(eq("ag_1"), any())).thenReturn(conversation);
        when(messageService.listByConversation("c_1")).thenReturn(List.of());
        when(messageService.appendTurn(eq("c_1"), anyString(), anyString())).thenAnswer(inv -> List.of(
                message("m1", Message.ROLE_USER, inv.getArgument(1)),
                message("m2", Message.ROLE_ASSISTANT, inv.getArgument(2))));

        orchestrator = new ChatConversationOrchestrator(agentService, conversationService, messageService,
                insightService, insightPublishService, completionService, new PostIntentDetector(),
                insightExtractor, new AgentPromptBuilder("http://localhost:8080"));
    }

    private static Message message(String id, String role, String content) {
        Message m = new Message();
        m.setId(id);
        m.setConversationId("c_1");
        m.setRole(role);
        m.setContent(content);
        m.setCreatedAt(LocalDateTime.now());
        return m;
    }

    private static List<String> labels(ChatMessageResponse resp) {
        return resp.getSteps().stream().map(AgentStepDto::getLabel).toList();
    }

    @Test
    void plainMessageGetsGroundedReply() {
        when(insightService.topForAgent("ag_1", 15)).thenReturn(List.of());
        when(completionService.complete(anyList(), anyString())).thenReturn(CompletionResult.ok("Chunk at 512 tokens."));

        ChatMessageResponse resp = orchestrator.postChatMessage("ag_1", "What chunk size works?", null);

        assertEquals("Chunk at 512 tokens.", resp.getReply());
        assertNull(resp.getPendingPost());
        assertEquals("sess-1", resp.getSessionId());
        assertEquals(2, resp.getMessages().size());
        assertEquals(List.of("Reading your message", "Generating response"), labels(resp));
        verify(messageService).appendTurn("c_1", "What chunk size works?", "Chunk at 512 tokens.");

        ArgumentCaptor<String> systemPrompt = ArgumentCaptor.forClass(String.class);
        verify(completionService).complete(anyList(), systemPrompt.capture());
        assertTrue(systemPrompt.getValue().contains("No insights posted yet."));
        verify(insightExtractor, never()).extract(anyList());
    }

    @Test
    void unavailableModelStillRecordsTurnWithCannedReply() {
        when(insightService.topForAgent("ag_1", 15)).thenReturn(List.of());
        when(completionService.complete(anyList(), anyString())).thenReturn(CompletionResult.timeout());

        ChatMessageResponse resp = orchestrator.postChatMessage("ag_1", "hello", "sess-1");

        assertEquals(CompletionResult.TIMEOUT_MESSAGE, resp.getReply());
        assertEquals(AgentStepDto.FAILED, resp.getSteps().get(1).getStatus());
        verify(messageService).appendTurn("c_1", "hello", CompletionResult.TIMEOUT_MESSAGE);
    }

    @Test
    void postIntentReturnsPreviewWithoutWritingInsight() {
        PendingPost preview = PendingPost.builder()
                .contentType(ContentType.INSIGHT).topic("RAG").phase("Debug")
                .problem("low recall").solution("rerank").build();
        when(insightExtractor.extract(anyList())).thenReturn(Optional.of(preview));

        ChatMessageResponse resp = orchestrator.postChatMessage("ag_1", "please post this as an insight: rerank fixes recall", "sess-1");

        assertSame(preview, resp.getPendingPost());
        assertTrue(resp.getReply().startsWith("I've prepared the following insight for posting."));
        assertEquals(List.of("Reading your message", "Identifying post intent",
                "Extracting content fields", "Awaiting your approval"), labels(resp));
        assertEquals(AgentStepDto.ACTIVE, resp.getSteps().get(3).getStatus());
        verify(insightPublishService, never()).publish(anyString(), any());
        verify(completionService, never()).complete(anyList(), anyString());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatTurn>> history = ArgumentCaptor.forClass(List.class);
        verify(insightExtractor).extract(history.capture());
        assertEquals("please post this as an insight: rerank fixes recall",
                history.getValue().get(history.getValue().size() - 1).content());
    }

    @Test
    void failedExtractionAsksForDetail() {
        when(insightExtractor.extract(anyList())).thenReturn(Optional.empty());

        ChatMessageResponse resp = orchestrator.postChatMessage("ag_1", "share something", "sess-1");

        assertNull(resp.getPendingPost());
        assertEquals(ChatConversationOrchestrator.NEED_DETAIL_REPLY, resp.getReply());
        assertEquals(AgentStepDto.FAILED, resp.getSteps().get(2).getStatus());
        verify(messageService).appendTurn("c_1", "share something", ChatConversationOrchestrator.NEED_DETAIL_REPLY);
    }

    @Test
    void confirmWritesInsightAndAppendsSuccessMessage() {
        PendingPost post = PendingPost.builder()
                .contentType(ContentType.IDEA).topic("Agent memory").phase("Idea")
                .problem("Shared scratchpad").solution("Agents write notes to a common store")
                .tags(List.of("memory")).build();
        Insight saved = Insight.builder().id("i1").topic("Agent memory").phase("Other")
                .problem("Shared scratchpad").solution("Agents write notes to a common store")
                .tags(List.of("memory")).verificationCount(0).build();
        when(insightPublishService.publish("ag_1", post)).thenReturn(saved);

        ChatMessageResponse resp = orchestrator.confirmPendingPost("ag_1", post, "sess-1");

        assertTrue(resp.getReply().startsWith("Idea posted successfully!"));
        assertTrue(resp.getReply().contains("**Title:** Shared scratchpad"));
        assertTrue(resp.getReply().contains("**Details:** Agents write notes to a common store"));
        assertTrue(resp.getReply().contains("**Tags:** memory"));
        assertEquals(List.of("Checking content scope", "Writing to database", "Indexing in vector store"), labels(resp));
        assertNull(resp.getPendingPost());
        verify(messageService).appendAssistant(eq("c_1"), eq(resp.getReply()));
    }

    @Test
    void confirmOutOfScopeAppendsRejection() {
        PendingPost post = PendingPost.builder().topic("Baking").phase("Other").problem("bread").solution("yeast").build();
        when(insightPublishService.publish("ag_1", post))
                .thenThrow(new ScopeRejectedException(0.05, 0.3, "Please stay on topic."));

        ChatMessageResponse resp = orchestrator.confirmPendingPost("ag_1", post, "sess-1");

        assertTrue(resp.getReply().startsWith("The post was rejected by the scope guard: Content outside of project scope."));
        assertTrue(resp.getReply().contains("0.050"));
        assertEquals(List.of("Checking content scope", "Scope check failed"), labels(resp));
        assertEquals(AgentStepDto.FAILED, resp.getSteps().get(1).getStatus());
        verify(messageService).appendAssistant(eq("c_1"), eq(resp.getReply()));
    }

    @Test
    void unknownAgentIsNotFound() {
        assertThrows(NotFoundException.class, () -> orchestrator.postChatMessage("missing", "hi", null));
        verify(messageService, never()).appendTurn(anyString(), anyString(), anyString());
    }

    @Test
    void historyOfUnknownSessionIsNotFound() {
        when(conversationService.findBySession("ag_1", "nope")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> orchestrator.getHistory("ag_1", "nope"));
    }

    @Test
    void historyReturnsOrderedThread() {
        when(conversationService.findBySession("ag_1", "sess-1")).thenReturn(Optional.of(conversation));
        when(messageService.listByConversation("c_1")).thenReturn(List.of(
                message("m1", Message.ROLE_USER, "hi"), message("m2", Message.ROLE_ASSISTANT, "hello")));

        var history = orchestrator.getHistory("ag_1", "sess-1");

        assertEquals("c_1", history.getConversationId());
        assertEquals(List.of("m1", "m2"), history.getMessages().stream().map(m -> m.getId()).toList());
    }

    @Test
    void clearHistoryDelegatesAndToleratesMissingSession() {
        when(conversationService.deleteWithMessages("ag_1", "gone")).thenReturn(false);

        assertDoesNotThrow(() -> orchestrator.clearHistory("ag_1", "gone"));
        verify(conversationService).deleteWithMessages("ag_1", "gone");
    }
}
