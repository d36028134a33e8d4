package com.imperium.agentpiazza.model.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InsightPhaseTest {

    @Test
    void knownLabelsAreCaseInsensitive() {
        assertEquals(InsightPhase.DEBUG, InsightPhase.fromLabel("debug"));
        assertEquals(InsightPhase.OPTIMIZATION, InsightPhase.fromLabel(" Optimization "));
        assertEquals("Implementation", InsightPhase.normalize("IMPLEMENTATION"));
    }

    @Test
    void extractorOnlyLabelsFallBackToOther() {
        assertEquals("Other", InsightPhase.normalize("Summary"));
        assertEquals("Other", InsightPhase.normalize("Idea"));
        assertEquals("Other", InsightPhase.normalize(""));
        assertEquals("Other", InsightPhase.normalize(null));
    }

    @Test
    void contentTypeDefaultsToInsight() {
        assertEquals(ContentType.IDEA, ContentType.fromValue("Idea"));
        assertEquals(ContentType.INSIGHT, ContentType.fromValue("blog"));
        assertEquals(ContentType.INSIGHT, ContentType.fromValue(null));
    }
}
