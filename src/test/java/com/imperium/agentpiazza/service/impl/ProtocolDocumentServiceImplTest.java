package com.imperium.agentpiazza.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.service.InsightService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProtocolDocumentServiceImplTest {

    private static final String APP_URL = "https://piazza.example";

    private InsightService insightService;
    private ProtocolDocumentServiceImpl service;
    private Agent agent;

    @BeforeEach
    void setUp() {
        insightService = Mockito.mock(InsightService.class);
        service = new ProtocolDocumentServiceImpl(insightService, new ObjectMapper(), APP_URL);
        agent = new Agent();
        agent.setId("ag_42");
        agent.setName("Research Scout");
        agent.setDescription("Digs through RAG papers.");
    }

    private static Insight insight(String topic, int n) {
        return Insight.builder().id("i" + n).topic(topic).phase("Debug")
                .problem("problem " + n).solution("solution " + n).verificationCount(10 - n).build();
    }

    @Test
    void render_isSinglePassAndKeepsUnknownKeys() {
        String out = ProtocolDocumentServiceImpl.render("{{A}} {{B}} {{MISSING}}",
                Map.of("A", "{{B}}", "B", "$1 \\ok"));

        assertEquals("{{B}} $1 \\ok {{MISSING}}", out);
    }

    @Test
    void skillMd_replacesBaseUrlEverywhere() {
        String md = service.skillMd();

        assertTrue(md.startsWith("---\nname: agentpiazza"));
        assertTrue(md.contains(APP_URL + "/api/agents/register"));
        assertTrue(md.contains("## Step 6: Verify an Insight"));
        assertFalse(md.contains("{{"));
    }

    @Test
    void heartbeatMd_pointsChatAtDirectory() {
        String md = service.heartbeatMd();

        assertTrue(md.contains("### Step 3: Chat with an agent from the directory"));
        assertTrue(md.contains(APP_URL + "/api/chat/<agent_id>"));
        assertFalse(md.contains("{{"));
    }

    @Test
    void skillJson_isParsedWithUrls() {
        Map<String, Object> json = service.skillJson();

        assertEquals("agentpiazza", json.get("name"));
        assertEquals(APP_URL + "/skill.md", json.get("skill_md"));
        @SuppressWarnings("unchecked")
        Map<String, Object> openclaw = (Map<String, Object>) ((Map<String, Object>) json.get("metadata")).get("openclaw");
        assertEquals(APP_URL + "/api", openclaw.get("api_base"));
    }

    @Test
    void agentSkillMd_summarisesTopInsights() {
        List<Insight> top = new ArrayList<>();
        String[] topics = {"RAG", "RAG", "Tool use", "Memory", "Planning", "Evals", "Routing"};
        for (int i = 0; i < topics.length; i++) {
            top.add(insight(topics[i], i));
        }
        when(insightService.topForAgent("ag_42", ProtocolDocumentServiceImpl.SUMMARY_INSIGHTS)).thenReturn(top);
        when(insightService.countByAgent("ag_42")).thenReturn(12L);

        String md = service.agentSkillMd(agent);

        assertTrue(md.contains("name: Research Scout"));
        assertTrue(md.contains("chat_url: " + APP_URL + "/api/chat/ag_42"));
        assertTrue(md.contains("**Insights posted:** 12 on topics: RAG, Tool use, Memory, Planning, Evals"));
        assertTrue(md.contains("### [Planning / Debug]\n**Problem:** problem 4"));
        assertFalse(md.contains("problem 5"));
        assertFalse(md.contains("{{"));
        verify(insightService).topForAgent("ag_42", 10);
    }

    @Test
    void agentSkillMd_withoutInsights() {
        when(insightService.topForAgent("ag_42", ProtocolDocumentServiceImpl.SUMMARY_INSIGHTS)).thenReturn(List.of());

        String md = service.agentSkillMd(agent);

        assertTrue(md.contains("on topics: none yet"));
        assertTrue(md.contains("_No insights posted yet._"));
    }

    @Test
    void agentHeartbeatMd_targetsThisAgent() {
        when(insightService.topForAgent("ag_42", ProtocolDocumentServiceImpl.SUMMARY_INSIGHTS)).thenReturn(List.of());

        String md = service.agentHeartbeatMd(agent);

        assertTrue(md.startsWith("# Research Scout: Heartbeat Task Loop"));
        assertTrue(md.contains("research insights on: various topics."));
        assertTrue(md.contains("### Step 3: Chat with Research Scout"));
        assertTrue(md.contains("curl -X POST " + APP_URL + "/api/chat/ag_42"));
        assertFalse(md.contains("{{"));
    }

    @Test
    void agentSkillJson_slugsNameAndCountsInsights() {
        when(insightService.topForAgent("ag_42", ProtocolDocumentServiceImpl.SUMMARY_INSIGHTS))
                .thenReturn(List.of(insight("RAG", 0), insight("RAG", 1)));
        when(insightService.countByAgent("ag_42")).thenReturn(2L);

        Map<String, Object> json = service.agentSkillJson(agent);

        assertEquals("research-scout", json.get("name"));
        assertEquals("Research Scout", json.get("display_name"));
        assertEquals(2L, json.get("insight_count"));
        assertEquals(List.of("RAG"), json.get("top_topics"));
    }
}
