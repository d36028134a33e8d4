package com.imperium.agentpiazza.service.impl;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class QdrantVectorIndexServiceTest {

    private final QdrantVectorIndexService disabled =
            new QdrantVectorIndexService(null, "insights-index", Duration.ofSeconds(1));

    @Test
    void disabledIndexReturnsNoMatches() {
        assertTrue(disabled.query(new float[]{1f, 0f}, 5).isEmpty());
    }

    @Test
    void disabledIndexIgnoresWrites() {
        String id = UUID.randomUUID().toString();
        assertDoesNotThrow(() -> disabled.upsert(id, new float[]{1f, 0f}, Map.of("topic", "RAG")));
        assertDoesNotThrow(() -> disabled.delete(id));
    }
}
