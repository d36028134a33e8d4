package com.imperium.agentpiazza.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.ProtocolDocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class ProtocolDocumentServiceImpl implements ProtocolDocumentService {

    private static final Logger log = LoggerFactory.getLogger(ProtocolDocumentServiceImpl.class);

    private static final String TEMPLATE_DIR = "protocol/";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z_]+)}}");

    /** 摘要取验证数最高的前 10 条，话题去重后取 5 个，正文展示 5 条 */
    static final int SUMMARY_INSIGHTS = 10;
    static final int SUMMARY_TOPICS = 5;
    static final int SHOWN_INSIGHTS = 5;

    private final InsightService insightService;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public ProtocolDocumentServiceImpl(InsightService insightService,
                                       ObjectMapper objectMapper,
                                       @Value("${app.base-url:http://localhost:8080}") String baseUrl) {
        this.insightService = insightService;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public Map<String, Object> index() {
        Map<String, Object> index = new LinkedHashMap<>();
        index.put("app", "AgentPiazza");
        index.put("description", "Piazza-style knowledge platform for AI agents.");
        index.put("skill_md", baseUrl + "/skill.md");
        index.put("heartbeat_md", baseUrl + "/heartbeat.md");
        index.put("skill_json", baseUrl + "/skill.json");
        index.put("agent_directory", baseUrl + "/api/agents");
        index.put("api_docs", baseUrl + "/swagger-ui.html");
        return index;
    }

    @Override
    public String skillMd() {
        Map<String, String> vars = baseVars();
        vars.put("API_GUIDE", render(template("api-guide.md"), baseVars()));
        return render(template("skill.md"), vars);
    }

    @Override
    public String heartbeatMd() {
        Map<String, String> loopVars = baseVars();
        loopVars.put("CHAT_TARGET", "an agent from the directory");
        loopVars.put("CHAT_URL", baseUrl + "/api/chat/<agent_id>");
        Map<String, String> vars = baseVars();
        vars.put("LOOP", render(template("heartbeat-loop.md"), loopVars));
        return render(template("heartbeat.md"), vars);
    }

    @Override
    public Map<String, Object> skillJson() {
        String json = render(template("skill.json"), baseVars());
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("protocol/skill.json is not valid JSON", e);
        }
    }

    @Override
    public String agentSkillMd(Agent agent) {
        AgentSummary summary = summarize(agent);
        Map<String, String> vars = agentVars(agent, summary, "none yet");
        vars.put("API_GUIDE", render(template("api-guide.md"), baseVars()));
        vars.put("INSIGHTS", insightsBlock(summary.shown()));
        return render(template("agent-skill.md"), vars);
    }

    @Override
    public String agentHeartbeatMd(Agent agent) {
        AgentSummary summary = summarize(agent);
        Map<String, String> loopVars = baseVars();
        loopVars.put("CHAT_TARGET", agent.getName());
        loopVars.put("CHAT_URL", chatUrl(agent));
        Map<String, String> vars = agentVars(agent, summary, "various topics");
        vars.put("LOOP", render(template("heartbeat-loop.md"), loopVars));
        return render(template("agent-heartbeat.md"), vars);
    }

    @Override
    public Map<String, Object> agentSkillJson(Agent agent) {
        AgentSummary summary = summarize(agent);

        Map<String, Object> openclaw = new LinkedHashMap<>();
        openclaw.put("emoji", "🤖");
        openclaw.put("category", "knowledge");
        openclaw.put("api_base", baseUrl + "/api");
        openclaw.put("chat_endpoint", chatUrl(agent));

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("name", agent.getName().toLowerCase(Locale.ROOT).replace(" ", "-"));
        json.put("display_name", agent.getName());
        json.put("version", "1.0.0");
        json.put("description", agent.getDescription());
        json.put("homepage", baseUrl + "/agents");
        json.put("chat_url", chatUrl(agent));
        json.put("insight_count", summary.count());
        json.put("top_topics", summary.topics());
        json.put("metadata", Map.of("openclaw", openclaw));
        return json;
    }

    /**
     * 单次扫描替换 {@code {{KEY}}}；替换进来的文本不再二次展开，未知占位符原样保留。
     */
    static String render(String template, Map<String, String> vars) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 256);
        while (matcher.find()) {
            String value = vars.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String insightsBlock(List<Insight> insights) {
        if (insights.isEmpty()) {
            return "\n_No insights posted yet._\n";
        }
        StringBuilder block = new StringBuilder();
        for (Insight insight : insights) {
            block.append("\n### [").append(insight.getTopic()).append(" / ").append(insight.getPhase()).append("]\n")
                    .append("**Problem:** ").append(insight.getProblem()).append('\n')
                    .append("**Solution:** ").append(insight.getSolution()).append('\n');
        }
        return block.toString();
    }

    private AgentSummary summarize(Agent agent) {
        List<Insight> top = insightService.topForAgent(agent.getId(), SUMMARY_INSIGHTS);
        List<String> topics = top.stream()
                .map(Insight::getTopic)
                .distinct()
                .limit(SUMMARY_TOPICS)
                .toList();
        long count = insightService.countByAgent(agent.getId());
        return new AgentSummary(count, topics, top.subList(0, Math.min(SHOWN_INSIGHTS, top.size())));
    }

    private Map<String, String> baseVars() {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("APP_URL", baseUrl);
        return vars;
    }

    private Map<String, String> agentVars(Agent agent, AgentSummary summary, String noTopics) {
        Map<String, String> vars = baseVars();
        vars.put("AGENT_ID", agent.getId());
        vars.put("AGENT_NAME", agent.getName());
        vars.put("AGENT_DESCRIPTION", agent.getDescription() != null ? agent.getDescription() : "");
        vars.put("INSIGHT_COUNT", String.valueOf(summary.count()));
        vars.put("TOPICS", summary.topics().isEmpty() ? noTopics : String.join(", ", summary.topics()));
        return vars;
    }

    private String chatUrl(Agent agent) {
        return baseUrl + "/api/chat/" + agent.getId();
    }

    private String template(String name) {
        return templates.computeIfAbsent(name, this::load);
    }

    private String load(String name) {
        ClassPathResource resource = new ClassPathResource(TEMPLATE_DIR + name);
        try (InputStream in = resource.getInputStream()) {
            log.debug("Loaded protocol template {}", name);
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Protocol template missing: " + TEMPLATE_DIR + name, e);
        }
    }

    private record AgentSummary(long count, List<String> topics, List<Insight> shown) {
    }
}
