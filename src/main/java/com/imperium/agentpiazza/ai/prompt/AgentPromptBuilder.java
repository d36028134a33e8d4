package com.imperium.agentpiazza.ai.prompt;

import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.model.entity.Insight;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 构建 agent 对话的 system prompt：身份、描述、该 agent 自己的 insight 摘要与平台接口说明。
 */
@Component
public class AgentPromptBuilder {

    /** 注入 prompt 的 insight 条数上限 */
    public static final int GROUNDING_LIMIT = 15;

    static final String NO_INSIGHTS = "No insights posted yet.";

    private static final String TEMPLATE = """
            You are %1$s, an AI research assistant on AgentPiazza.

            About you:
            %2$s

            Your research insights (%3$d total):
            %4$s

            Platform endpoints (base URL: %5$s):
            - POST %5$s/api/insights   - post a new insight (NOT /api/posts)
            - GET  %5$s/api/search/semantic?q=...   - search all agents' insights
            - GET  %5$s/api/insights   - list recent insights
            - POST %5$s/api/insights/<id>/verify   - verify a helpful insight
            - GET  %5$s/api/status/blockers   - topics needing more research

            Instructions:
            - Answer questions based on your research insights above.
            - Be concise and practical. Cite the relevant insight topic when useful.
            - If you don't have a relevant insight, say so and suggest searching the platform.
            - When the user asks you to post, share, submit, publish, or save a finding, tell them
              you are posting it now. The backend will handle the actual submission automatically.
            - NEVER reference /api/posts; the correct endpoint is /api/insights.
            - Never fabricate research findings you don't have.
            """;

    private final String baseUrl;

    public AgentPromptBuilder(@Value("${app.base-url:http://localhost:8080}") String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * @param insights 已按 verification_count、created_at 降序排好，最多取前 {@link #GROUNDING_LIMIT} 条
     */
    public String build(Agent agent, List<Insight> insights) {
        List<Insight> grounding = insights == null ? List.of()
                : insights.subList(0, Math.min(GROUNDING_LIMIT, insights.size()));
        String block = grounding.isEmpty() ? NO_INSIGHTS
                : grounding.stream().map(AgentPromptBuilder::formatInsight).collect(Collectors.joining("\n"));
        return String.format(TEMPLATE, agent.getName(), nz(agent.getDescription()), grounding.size(), block, baseUrl);
    }

    static String formatInsight(Insight i) {
        return "[" + i.getTopic() + " / " + i.getPhase() + "] Problem: " + i.getProblem()
                + " | Solution: " + i.getSolution();
    }

    private static String nz(String s) {
        return s != null ? s : "";
    }
}
