package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.exception.ForbiddenException;
import com.imperium.agentpiazza.exception.NotFoundException;
import com.imperium.agentpiazza.exception.ScopeRejectedException;
import com.imperium.agentpiazza.guard.ScopeGuard;
import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import com.imperium.agentpiazza.model.dto.request.CreateInsightRequest;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.model.enums.ContentType;
import com.imperium.agentpiazza.service.EmbeddingService;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.VectorIndexService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InsightPublishServiceImplTest {

    private InsightService insightService;
    private ScopeGuard scopeGuard;
    private EmbeddingService embeddingService;
    private VectorIndexService vectorIndexService;
    private InsightPublishServiceImpl service;

    @BeforeEach
    void setUp() {
        insightService = Mockito.mock(InsightService.class);
        scopeGuard = Mockito.mock(ScopeGuard.class);
        embeddingService = Mockito.mock(EmbeddingService.class);
        vectorIndexService = Mockito.mock(VectorIndexService.class);
        when(embeddingService.embed(anyString())).thenReturn(new float[]{1f, 0f});
        service = new InsightPublishServiceImpl(insightService, scopeGuard, embeddingService, vectorIndexService);
    }

    private static CreateInsightRequest request() {
        CreateInsightRequest.Content content = new CreateInsightRequest.Content();
        content.setProblem("Agent loops forever on tool errors");
        content.setSolution("Cap retries and surface the error to the planner");
        CreateInsightRequest req = new CreateInsightRequest();
        req.setTopic("Tool use");
        req.setPhase("Debug");
        req.setContent(content);
        req.setTags(List.of("tools", "retries"));
        return req;
    }

    @Test
    void create_savesWithZeroVerificationsAndIndexes() {
        Insight created = service.create("ag_a", request());

        assertEquals(0, created.getVerificationCount());
        assertEquals("ag_a", created.getAgentId());
        assertEquals("", created.getSourceRef());
        assertEquals(36, created.getId().length());
        verify(insightService).save(created);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(vectorIndexService).upsert(eq(created.getId()), any(float[].class), metadata.capture());
        assertEquals("Tool use", metadata.getValue().get("topic"));
        assertEquals("ag_a", metadata.getValue().get("agent_id"));
        assertEquals(0, metadata.getValue().get("verification_count"));
        verify(embeddingService).embed("Tool use Debug Agent loops forever on tool errors Cap retries and surface the error to the planner");
    }

    @Test
    void create_outOfScopeWritesNothing() {
        doThrow(new ScopeRejectedException(0.1, 0.3, "hint"))
                .when(scopeGuard).enforce(anyString(), anyString(), anyString(), anyString());

        assertThrows(ScopeRejectedException.class, () -> service.create("ag_a", request()));

        verify(insightService, never()).save(any());
        verify(vectorIndexService, never()).upsert(anyString(), any(float[].class), anyMap());
    }

    @Test
    void create_indexFailureIsSwallowed() {
        doThrow(new IllegalStateException("qdrant down"))
                .when(vectorIndexService).upsert(anyString(), any(float[].class), anyMap());

        Insight created = service.create("ag_a", request());

        assertNotNull(created.getId());
        verify(insightService).save(created);
    }

    @Test
    void publish_normalisesPhaseOfSummary() {
        PendingPost post = PendingPost.builder()
                .contentType(ContentType.SUMMARY)
                .topic("Lecture 4 recap")
                .phase("Summary")
                .problem("Lecture 4")
                .solution("Agents plan with tools")
                .build();

        Insight created = service.publish("ag_a", post);

        assertEquals("Other", created.getPhase());
        verify(scopeGuard).enforce("Lecture 4 recap", "Other", "Lecture 4", "Agents plan with tools");
    }

    @Test
    void publish_outOfScopeWritesNothing() {
        doThrow(new ScopeRejectedException(0.12, 0.3, "hint"))
                .when(scopeGuard).enforce(anyString(), anyString(), anyString(), anyString());
        PendingPost post = PendingPost.builder()
                .topic("Sourdough starter")
                .phase("Setup")
                .problem("Starter does not rise")
                .solution("Feed twice a day")
                .build();

        assertThrows(ScopeRejectedException.class, () -> service.publish("ag_a", post));

        verify(insightService, never()).save(any());
        verify(embeddingService, never()).embed(anyString());
        verify(vectorIndexService, never()).upsert(anyString(), any(float[].class), anyMap());
    }

    @Test
    void verify_ownInsightIsForbiddenAndNotIncremented() {
        when(insightService.getById("i1")).thenReturn(Insight.builder().id("i1").agentId("ag_a").verificationCount(0).build());

        ForbiddenException ex = assertThrows(ForbiddenException.class, () -> service.verify("ag_a", "i1"));

        assertEquals("cannot_verify_own", ex.getCode());
        assertEquals(400, ex.getStatus().value());
        verify(insightService, never()).incrementVerification(anyString());
    }

    @Test
    void verify_missingInsightIsNotFound() {
        assertThrows(NotFoundException.class, () -> service.verify("ag_b", "nope"));
        verify(insightService, never()).incrementVerification(anyString());
    }

    @Test
    void verify_otherAgentIncrementsThenReindexesCommittedCount() {
        Insight before = Insight.builder().id("i1").topic("t").phase("Setup").problem("p").solution("s")
                .agentId("ag_a").verificationCount(2).build();
        Insight after = Insight.builder().id("i1").topic("t").phase("Setup").problem("p").solution("s")
                .agentId("ag_a").verificationCount(3).build();
        when(insightService.getById("i1")).thenReturn(before);
        when(insightService.incrementVerification("i1")).thenReturn(after);

        Insight updated = service.verify("ag_b", "i1");

        assertEquals(3, updated.getVerificationCount());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        InOrder order = inOrder(insightService, embeddingService, vectorIndexService);
        order.verify(insightService).incrementVerification("i1");
        order.verify(embeddingService).embed(anyString());
        order.verify(vectorIndexService).upsert(eq("i1"), any(float[].class), metadata.capture());
        assertEquals(3, metadata.getValue().get("verification_count"));
    }

    @Test
    void verify_rowDeletedBeforeIncrementIsNotFound() {
        when(insightService.getById("i1")).thenReturn(Insight.builder().id("i1").agentId("ag_a").build());
        when(insightService.incrementVerification("i1")).thenReturn(null);

        assertThrows(NotFoundException.class, () -> service.verify("ag_b", "i1"));
        verify(vectorIndexService, never()).upsert(anyString(), any(float[].class), anyMap());
    }

    @Test
    void verify_indexFailureKeepsCommittedCount() {
        when(insightService.getById("i1")).thenReturn(Insight.builder().id("i1").agentId("ag_a").build());
        when(insightService.incrementVerification("i1")).thenReturn(
                Insight.builder().id("i1").topic("t").phase("Debug").agentId("ag_a").verificationCount(1).build());
        doThrow(new IllegalStateException("qdrant down"))
                .when(vectorIndexService).upsert(anyString(), any(float[].class), anyMap());

        assertEquals(1, service.verify("ag_b", "i1").getVerificationCount());
    }
}
