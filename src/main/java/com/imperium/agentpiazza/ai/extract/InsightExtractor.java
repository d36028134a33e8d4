package com.imperium.agentpiazza.ai.extract;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.agentpiazza.ai.completion.ChatTurn;
import com.imperium.agentpiazza.ai.completion.CompletionResult;
import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import com.imperium.agentpiazza.model.enums.ContentType;
import com.imperium.agentpiazza.service.CompletionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 让 LLM 从对话中抽取待发布内容的结构化字段。
 * 抽取失败（模型不可用、输出不是 JSON 对象、或返回 error 标记）一律返回空。
 */
@Component
public class InsightExtractor {

    private static final Logger log = LoggerFactory.getLogger(InsightExtractor.class);

    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {};
    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*\\n?");

    static final String EXTRACT_PROMPT = """
            The user wants to post content to a research platform. Read the conversation and extract the content.
            Determine the content_type based on what the user is sharing:
            - "insight": a problem/solution pair from hands-on research
            - "summary": a summary or recap of a topic, paper, discussion, or session
            - "idea": a new idea, proposal, or hypothesis the user wants to share

            Return ONLY a single valid JSON object (no prose, no markdown fences) with exactly these keys:
            {
              "content_type": "insight or summary or idea",
              "topic": "short topic name",
              "phase": "for insight use Setup/Implementation/Optimization/Debug/Other; for summary use Summary; for idea use Idea",
              "problem": "for insight: the challenge; for summary: what is being summarized; for idea: the idea title or proposal",
              "solution": "for insight: what solved it; for summary: the full summary body; for idea: details and reasoning",
              "source_ref": "optional URL or citation, or empty string",
              "tags": ["tag1", "tag2"]
            }
            If you cannot extract clear content from the conversation, return:
            {"error": "cannot extract"}
            """;

    private final CompletionService completionService;
    private final ObjectMapper objectMapper;

    public InsightExtractor(CompletionService completionService, ObjectMapper objectMapper) {
        this.completionService = completionService;
        this.objectMapper = objectMapper;
    }

    /**
     * @param conversation 完整历史（含本轮用户消息）
     */
    public Optional<PendingPost> extract(List<ChatTurn> conversation) {
        CompletionResult result = completionService.complete(conversation, EXTRACT_PROMPT);
        if (!result.isSuccess()) {
            log.info("Extraction skipped, completion status {}", result.status());
            return Optional.empty();
        }
        return parse(result.text()).map(InsightExtractor::toPendingPost);
    }

    /**
     * 去掉代码围栏后取第一个 '{' 到最后一个 '}' 解析；含 error 键视为失败。
     */
    Optional<Map<String, Object>> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String cleaned = FENCE.matcher(raw).replaceAll("").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            Map<String, Object> fields = objectMapper.readValue(cleaned.substring(start, end + 1), FIELDS_TYPE);
            if (fields == null || fields.containsKey("error")) {
                return Optional.empty();
            }
            return Optional.of(fields);
        } catch (Exception e) {
            log.debug("Extraction output is not a JSON object: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static PendingPost toPendingPost(Map<String, Object> fields) {
        Object phase = fields.get("phase");
        return PendingPost.builder()
                .contentType(ContentType.fromValue(text(fields.get("content_type"))))
                .topic(text(fields.get("topic")))
                .phase(phase == null || text(phase).isBlank() ? "Other" : text(phase))
                .problem(text(fields.get("problem")))
                .solution(text(fields.get("solution")))
                .sourceRef(text(fields.get("source_ref")))
                .tags(tags(fields.get("tags")))
                .build();
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static List<String> tags(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String tag = text(item);
                if (!tag.isEmpty() && !out.contains(tag)) {
                    out.add(tag);
                }
            }
        } else if (value instanceof String s && !s.isBlank()) {
            for (String part : s.split(",")) {
                if (!part.isBlank() && !out.contains(part.trim())) {
                    out.add(part.trim());
                }
            }
        }
        return out;
    }
}
