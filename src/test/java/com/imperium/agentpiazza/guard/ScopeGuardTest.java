package com.imperium.agentpiazza.guard;

import com.imperium.agentpiazza.exception.ScopeRejectedException;
import com.imperium.agentpiazza.service.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScopeGuardTest {

    private static final String SCOPE = "AI agents and LLM tooling";
    private static final String HINT = "Please keep it about agents.";

    private EmbeddingService embeddingService;
    private ScopeGuard guard;

    @BeforeEach
    void setUp() {
        embeddingService = Mockito.mock(EmbeddingService.class);
        when(embeddingService.embed(SCOPE)).thenReturn(new float[]{1f, 0f});
        guard = new ScopeGuard(embeddingService, SCOPE, 0.3, HINT);
    }

    @Test
    void buildInsightText_joinsFieldsWithSingleSpaces() {
        assertEquals("RAG Debug slow recall add reranker",
                ScopeGuard.buildInsightText("RAG", "Debug", "slow recall", "add reranker"));
        assertEquals("t   ", ScopeGuard.buildInsightText("t", null, null, null));
    }

    @Test
    void check_scoreIsDotProductWithReference() {
        when(embeddingService.embed("RAG Debug p s")).thenReturn(new float[]{0.6f, 0.8f});

        ScopeCheckResult result = guard.check("RAG", "Debug", "p", "s");

        assertEquals(0.6, result.score(), 1e-6);
        assertEquals(0.3, result.threshold());
        assertTrue(result.accepted());
    }

    @Test
    void classify_scoresArbitraryText() {
        when(embeddingService.embed("tool calling loops")).thenReturn(new float[]{-0.8f, 0.6f});

        assertEquals(-0.8, guard.classify("tool calling loops"), 1e-6);
        assertEquals(1.0, guard.classify(SCOPE), 1e-6);
    }

    @Test
    void enforce_belowThresholdThrowsWithDetails() {
        when(embeddingService.embed("Cooking Other pasta boil water")).thenReturn(new float[]{0.1f, 0.995f});

        ScopeRejectedException ex = assertThrows(ScopeRejectedException.class,
                () -> guard.enforce("Cooking", "Other", "pasta", "boil water"));

        assertEquals(403, ex.getStatus().value());
        assertEquals("out_of_scope", ex.getCode());
        assertEquals(0.3, ex.getThreshold());
        assertEquals(0.1, (double) ex.getDetails().get("similarity_score"), 1e-4);
        assertTrue(ex.getHint().contains("0.100"));
        assertTrue(ex.getHint().endsWith(HINT));
    }

    @Test
    void enforce_scoreEqualToThresholdIsAccepted() {
        when(embeddingService.embed(anyString())).thenAnswer(inv ->
                SCOPE.equals(inv.getArgument(0)) ? new float[]{1f, 0f} : new float[]{0.5f, 0f});
        ScopeGuard halfGuard = new ScopeGuard(embeddingService, SCOPE, 0.5, HINT);

        assertEquals(0.5, halfGuard.enforce("a", "b", "c", "d"), 1e-9);
    }

    @Test
    void referenceEmbeddingIsComputedOnce() {
        when(embeddingService.embed("a Setup b c")).thenReturn(new float[]{0.9f, 0.1f});

        guard.check("a", "Setup", "b", "c");
        guard.check("a", "Setup", "b", "c");
        guard.check("a", "Setup", "b", "c");

        verify(embeddingService, times(1)).embed(SCOPE);
    }
}
