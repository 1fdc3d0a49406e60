package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.model.entity.ConversationAnalytics;
import com.imperium.unbuilt.model.entity.ConversationVariant;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.model.entity.MessageReport;
import com.imperium.unbuilt.model.entity.SuggestedQuestion;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话持久化接缝：会话、消息日志、推荐问题、统计、变体与举报。
 * <p>
 * 消息在会话内按 sequence 全序；所有返回消息列表的方法都按时间正序（旧 → 新）。
 */
public interface ConversationStore {

    /** 同一 (analysisId, userId) 并发调用只会创建一个会话 */
    ConversationHandle getOrCreateConversation(String analysisId, String userId);

    Conversation getConversation(String conversationId);

    /** 追加消息：id、sequence、createdAt 为空时由存储分配 */
    Message appendMessage(Message message);

    /**
     * 原子地追加一问一答：两条都写入，或者都不写入，sequence 相邻。
     */
    void appendExchange(Message userMessage, Message assistantMessage);

    void updateMessage(Message message);

    Message getMessage(String messageId);

    /** 最近 limit 条消息，时间正序 */
    List<Message> getRecentMessages(String conversationId, int limit);

    /** 分页读取，offset 从最早的消息算起 */
    List<Message> getMessages(String conversationId, int limit, int offset);

    long countMessages(String conversationId);

    /** 删除消息和推荐问题，统计归零，会话本身保留 */
    void clearConversation(String conversationId);

    // ---------- 推荐问题 ----------

    /** 按 priority 降序 */
    List<SuggestedQuestion> getSuggestedQuestions(String conversationId, boolean includeUsed);

    /** 丢弃未使用的旧问题，写入新问题 */
    List<SuggestedQuestion> replaceSuggestedQuestions(String conversationId, List<SuggestedQuestion> questions);

    SuggestedQuestion getSuggestedQuestion(String questionId);

    void markSuggestionUsed(String questionId);

    // ---------- 统计 ----------

    /** 不存在时返回全零统计 */
    ConversationAnalytics getAnalytics(String conversationId);

    /** 记录一问一答：消息数 +2，累加 token，更新平均响应时间 */
    void recordExchange(String conversationId, int tokensUsed, long processingTimeMs);

    /**
     * 写入评分。消息此前未被评分时（以存储中的状态为准，并发下只有一个调用成立）
     * 同时把评分计入会话满意度均值，并返回 true。
     */
    boolean rateMessage(String messageId, String conversationId, int rating, String feedback);

    // ---------- 变体与举报 ----------

    ConversationVariant addVariant(ConversationVariant variant);

    List<ConversationVariant> getVariants(String conversationId);

    MessageReport saveReport(MessageReport report);

    long countReportsSince(String userId, LocalDateTime since);

    /** getOrCreate 的结果，created 表示本次新建 */
    record ConversationHandle(Conversation conversation, boolean created) {
    }
}
