package com.imperium.unbuilt.service;

import com.imperium.unbuilt.ai.orchestrator.ConversationLockRegistry;
import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.exception.ValidationFailedException;
import com.imperium.unbuilt.model.dto.response.ConversationDetailResponse;
import com.imperium.unbuilt.model.dto.response.MessageDto;
import com.imperium.unbuilt.model.dto.response.MessageHistoryResponse;
import com.imperium.unbuilt.model.dto.response.SuggestionDto;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.policy.ConversationRateLimiter;
import com.imperium.unbuilt.policy.SubscriptionTier;
import com.imperium.unbuilt.service.ConversationStore.ConversationHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 会话生命周期：打开（不存在则创建）、分页历史、清空。
 */
@Service
public class ConversationLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ConversationLifecycleService.class);
    private static final Logger auditLog = LoggerFactory.getLogger("security");

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 100;

    private final ConversationStore store;
    private final ConversationAccess access;
    private final AnalysisService analysisService;
    private final SuggestionService suggestionService;
    private final ConversationRateLimiter rateLimiter;
    private final QueryDeduplicationCache dedupCache;
    private final ConversationLockRegistry lockRegistry;
    private final ConversationProperties properties;

    public ConversationLifecycleService(ConversationStore store,
                                        ConversationAccess access,
                                        AnalysisService analysisService,
                                        SuggestionService suggestionService,
                                        ConversationRateLimiter rateLimiter,
                                        QueryDeduplicationCache dedupCache,
                                        ConversationLockRegistry lockRegistry,
                                        ConversationProperties properties) {
        this.store = store;
        this.access = access;
        this.analysisService = analysisService;
        this.suggestionService = suggestionService;
        this.rateLimiter = rateLimiter;
        this.dedupCache = dedupCache;
        this.lockRegistry = lockRegistry;
        this.properties = properties;
    }

    /**
     * 取得或创建 (analysisId, userId) 的会话并返回详情。会话还没有任何推荐问题时生成初始问题。
     */
    public ConversationDetailResponse openConversation(String analysisId, String userId, SubscriptionTier tier) {
        Analysis analysis = analysisService.requireOwnedAnalysis(analysisId, userId);
        ConversationHandle handle = store.getOrCreateConversation(analysis.getId(), userId);
        Conversation conversation = handle.conversation();
        String conversationId = conversation.getId();

        List<SuggestionDto> suggestions;
        if (store.getSuggestedQuestions(conversationId, true).isEmpty()) {
            suggestions = suggestionService.initialSuggestions(conversationId,
                    analysisService.loadSummary(analysis, properties.getContext().getSummaryGapLimit()));
        } else {
            suggestions = store.getSuggestedQuestions(conversationId, false).stream().map(SuggestionDto::from).toList();
        }

        List<MessageDto> messages = store.getRecentMessages(conversationId, properties.getContext().getHistoryLimit())
                .stream()
                .map(MessageDto::from)
                .toList();

        if (handle.created()) {
            log.info("Conversation created: conversationId={}, analysisId={}, userId={}", conversationId, analysisId, userId);
        }
        return ConversationDetailResponse.builder()
                .conversation(conversation)
                .messages(messages)
                .totalMessages(store.countMessages(conversationId))
                .suggestions(suggestions)
                .analytics(store.getAnalytics(conversationId))
                .rateLimit(rateLimiter.peek(userId, conversationId, tier))
                .build();
    }

    public MessageHistoryResponse getHistory(String conversationId, String userId, Integer limit, Integer offset) {
        int pageSize = limit == null ? DEFAULT_PAGE_SIZE : limit;
        int start = offset == null ? 0 : offset;
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationFailedException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (start < 0) {
            throw new ValidationFailedException("offset must not be negative");
        }
        access.requireOwned(conversationId, userId);

        List<MessageDto> messages = store.getMessages(conversationId, pageSize, start).stream()
                .map(MessageDto::from)
                .toList();
        long total = store.countMessages(conversationId);
        return MessageHistoryResponse.builder()
                .conversationId(conversationId)
                .messages(messages)
                .total(total)
                .limit(pageSize)
                .offset(start)
                .hasMore(start + messages.size() < total)
                .build();
    }

    /**
     * 清空会话：删除消息与推荐问题，统计归零，同时清掉去重缓存和会话级限额。
     * 在会话锁内执行，不会与进行中的消息交错。
     */
    public void clearConversation(String conversationId, String userId, boolean confirm) {
        if (!confirm) {
            throw new ValidationFailedException("Clearing a conversation requires confirm=true");
        }
        access.requireOwned(conversationId, userId);

        long deleted;
        try (ConversationLockRegistry.Lease ignored = lockRegistry.acquire(conversationId)) {
            deleted = store.countMessages(conversationId);
            store.clearConversation(conversationId);
            dedupCache.evictConversation(conversationId);
            rateLimiter.resetConversation(userId, conversationId);
        }
        auditLog.info("Conversation cleared: conversationId={}, userId={}, messagesDeleted={}", conversationId, userId, deleted);
    }
}
