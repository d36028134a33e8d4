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
import com.imperium.agentpiazza.model.dto.response.ChatHistoryResponse;
import com.imperium.agentpiazza.model.dto.response.ChatMessageDto;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 对话编排器。
 * <p>
 * 每轮：定位 agent 与会话 → 加载历史 → 判断发帖意图 →
 * 有意图则抽取字段生成预览（不落 insight），否则基于 agent 自己的 insight 生成回复 →
 * 同一事务内追加 user/assistant 两条消息。
 * <p>
 * 预览内容不在服务端保存；confirm 时由客户端回传并重新做范围校验。
 */
@Service
public class ChatConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChatConversationOrchestrator.class);

    static final String STEP_READING = "Reading your message";
    static final String STEP_INTENT = "Identifying post intent";
    static final String STEP_EXTRACTED = "Extracting content fields";
    static final String STEP_AWAITING = "Awaiting your approval";
    static final String STEP_EXTRACT_FAILED = "Could not extract fields";
    static final String STEP_GENERATING = "Generating response";
    static final String STEP_SCOPE = "Checking content scope";
    static final String STEP_SCOPE_FAILED = "Scope check failed";
    static final String STEP_WRITING = "Writing to database";
    static final String STEP_INDEXING = "Indexing in vector store";

    static final String NEED_DETAIL_REPLY = """
            I want to post this for you, but I need a bit more detail. Please tell me:
            - **Topic** (e.g. 'RAG Pipeline Optimization')
            - **Content type**: insight (problem/solution), summary, or idea
            - **What it's about** and **key details**

            Once you share those, I'll prepare a preview for you to confirm.""";

    private final AgentService agentService;
    private final ConversationService conversationService;
    private final MessageService messageService;
    private final InsightService insightService;
    private final InsightPublishService insightPublishService;
    private final CompletionService completionService;
    private final PostIntentDetector postIntentDetector;
    private final InsightExtractor insightExtractor;
    private final AgentPromptBuilder promptBuilder;

    public ChatConversationOrchestrator(AgentService agentService,
                                        ConversationService conversationService,
                                        MessageService messageService,
                                        InsightService insightService,
                                        InsightPublishService insightPublishService,
                                        CompletionService completionService,
                                        PostIntentDetector postIntentDetector,
                                        InsightExtractor insightExtractor,
                                        AgentPromptBuilder promptBuilder) {
        this.agentService = agentService;
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.insightService = insightService;
        this.insightPublishService = insightPublishService;
        this.completionService = completionService;
        this.postIntentDetector = postIntentDetector;
        this.insightExtractor = insightExtractor;
        this.promptBuilder = promptBuilder;
    }

    // ==================== 公开入口 ====================

    public ChatMessageResponse postChatMessage(String agentId, String userText, String sessionId) {
        // ---------- 1. 定位 agent 与会话 ----------
        Agent agent = agentService.requireById(agentId);
        Conversation conversation = conversationService.getOrCreate(agent.getId(), sessionId);
        List<Message> prior = messageService.listByConversation(conversation.getId());

        List<ChatTurn> history = new ArrayList<>(prior.size() + 1);
        prior.forEach(m -> history.add(ChatTurn.from(m)));
        history.add(ChatTurn.user(userText));

        // ---------- 2. 分支：发帖预览 / 普通回复 ----------
        List<AgentStepDto> steps = new ArrayList<>();
        steps.add(AgentStepDto.done(STEP_READING));
        PendingPost pendingPost = null;
        String reply;

        if (postIntentDetector.hasPostIntent(userText)) {
            steps.add(AgentStepDto.done(STEP_INTENT));
            Optional<PendingPost> extracted = insightExtractor.extract(history);
            if (extracted.isPresent()) {
                pendingPost = extracted.get();
                steps.add(AgentStepDto.done(STEP_EXTRACTED));
                steps.add(AgentStepDto.active(STEP_AWAITING));
                reply = previewReply(pendingPost.getContentType());
            } else {
                steps.add(AgentStepDto.failed(STEP_EXTRACT_FAILED));
                reply = NEED_DETAIL_REPLY;
            }
        } else {
            List<Insight> grounding = insightService.topForAgent(agent.getId(), AgentPromptBuilder.GROUNDING_LIMIT);
            CompletionResult result = completionService.complete(history, promptBuilder.build(agent, grounding));
            steps.add(result.isSuccess() ? AgentStepDto.done(STEP_GENERATING) : AgentStepDto.failed(STEP_GENERATING));
            reply = result.text();
        }

        // ---------- 3. 落库 ----------
        List<Message> appended = messageService.appendTurn(conversation.getId(), userText, reply);
        List<Message> thread = new ArrayList<>(prior);
        thread.addAll(appended);

        return ChatMessageResponse.builder()
                .reply(reply)
                .conversationId(conversation.getId())
                .sessionId(conversation.getSessionId())
                .messages(toDtos(thread))
                .steps(steps)
                .pendingPost(pendingPost)
                .build();
    }

    public ChatMessageResponse confirmPendingPost(String agentId, PendingPost pendingPost, String sessionId) {
        Agent agent = agentService.requireById(agentId);
        List<AgentStepDto> steps = new ArrayList<>();
        steps.add(AgentStepDto.done(STEP_SCOPE));

        String reply;
        try {
            Insight insight = insightPublishService.publish(agent.getId(), pendingPost);
            steps.add(AgentStepDto.done(STEP_WRITING));
            steps.add(AgentStepDto.done(STEP_INDEXING));
            reply = successReply(pendingPost.getContentType(), insight);
        } catch (ScopeRejectedException e) {
            steps.add(AgentStepDto.failed(STEP_SCOPE_FAILED));
            reply = "The post was rejected by the scope guard: " + e.getMessage() + " " + e.getHint();
        }

        Conversation conversation = conversationService.getOrCreate(agent.getId(), sessionId);
        messageService.appendAssistant(conversation.getId(), reply);
        List<Message> thread = messageService.listByConversation(conversation.getId());

        return ChatMessageResponse.builder()
                .reply(reply)
                .conversationId(conversation.getId())
                .sessionId(conversation.getSessionId())
                .messages(toDtos(thread))
                .steps(steps)
                .pendingPost(null)
                .build();
    }

    public ChatHistoryResponse getHistory(String agentId, String sessionId) {
        agentService.requireById(agentId);
        Conversation conversation = conversationService.findBySession(agentId, sessionId)
                .orElseThrow(() -> new NotFoundException("Session not found",
                        "Start a new conversation via POST /api/chat/" + agentId));
        return ChatHistoryResponse.builder()
                .conversationId(conversation.getId())
                .sessionId(conversation.getSessionId())
                .agentId(agentId)
                .messages(toDtos(messageService.listByConversation(conversation.getId())))
                .build();
    }

    /**
     * 会话不存在时为空操作。
     */
    public void clearHistory(String agentId, String sessionId) {
        if (!conversationService.deleteWithMessages(agentId, sessionId)) {
            log.debug("Nothing to clear for agent {} session {}", agentId, sessionId);
        }
    }

    // ==================== 回复文本 ====================

    static String previewReply(ContentType type) {
        return "I've prepared the following " + label(type) + " for posting. "
                + "Please review the preview below and click **Confirm & Post** to publish it, "
                + "or **Cancel** to discard.";
    }

    static String successReply(ContentType type, Insight insight) {
        boolean isInsight = type == null || type == ContentType.INSIGHT;
        String typeLabel = label(type);
        String capitalized = Character.toUpperCase(typeLabel.charAt(0)) + typeLabel.substring(1);
        List<String> tags = insight.getTags() != null ? insight.getTags() : List.of();
        return capitalized + " posted successfully!\n\n"
                + "**Topic:** " + insight.getTopic() + "\n"
                + "**Phase:** " + insight.getPhase() + "\n"
                + "**" + (isInsight ? "Problem" : "Title") + ":** " + insight.getProblem() + "\n"
                + "**" + (isInsight ? "Solution" : "Details") + ":** " + insight.getSolution() + "\n"
                + "**Tags:** " + String.join(", ", tags) + "\n\n"
                + "It is now visible on the dashboard.";
    }

    private static String label(ContentType type) {
        return type != null ? type.getValue() : ContentType.INSIGHT.getValue();
    }

    private static List<ChatMessageDto> toDtos(List<Message> messages) {
        return messages.stream().map(ChatMessageDto::from).toList();
    }
}
