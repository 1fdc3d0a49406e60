package com.imperium.unbuilt.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.imperium.unbuilt.config.IdSupport;
import com.imperium.unbuilt.mapper.ConversationAnalyticsMapper;
import com.imperium.unbuilt.mapper.ConversationVariantMapper;
import com.imperium.unbuilt.mapper.MessageReportMapper;
import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.model.entity.ConversationAnalytics;
import com.imperium.unbuilt.model.entity.ConversationVariant;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.model.entity.MessageReport;
import com.imperium.unbuilt.model.entity.SuggestedQuestion;
import com.imperium.unbuilt.service.ConversationService;
import com.imperium.unbuilt.service.ConversationStore;
import com.imperium.unbuilt.service.MessageService;
import com.imperium.unbuilt.service.SuggestedQuestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MyBatis-Plus 实现的会话存储。
 * <p>
 * 消息 sequence 取会话内 max+1，(conversation_id, sequence) 唯一索引兜底；
 * 流水线在会话锁内追加消息，冲突只会出现在绕过流水线的写入上，此时重试。
 */
@Service
public class MybatisConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisConversationStore.class);

    private static final int SEQUENCE_RETRIES = 3;

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final SuggestedQuestionService suggestedQuestionService;
    private final ConversationAnalyticsMapper analyticsMapper;
    private final ConversationVariantMapper variantMapper;
    private final MessageReportMapper reportMapper;

    public MybatisConversationStore(ConversationService conversationService,
                                    MessageService messageService,
                                    SuggestedQuestionService suggestedQuestionService,
                                    ConversationAnalyticsMapper analyticsMapper,
                                    ConversationVariantMapper variantMapper,
                                    MessageReportMapper reportMapper) {
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.suggestedQuestionService = suggestedQuestionService;
        this.analyticsMapper = analyticsMapper;
        this.variantMapper = variantMapper;
        this.reportMapper = reportMapper;
    }

    // ==================== 会话 ====================

    @Override
    public ConversationHandle getOrCreateConversation(String analysisId, String userId) {
        Conversation existing = conversationService.findByAnalysisAndUser(analysisId, userId);
        if (existing != null) {
            return new ConversationHandle(existing, false);
        }
        LocalDateTime now = LocalDateTime.now();
        Conversation conversation = new Conversation(IdSupport.newId("c_"), analysisId, userId, now, now);
        try {
            conversationService.save(conversation);
        } catch (DuplicateKeyException e) {
            // 并发创建：唯一索引 (analysis_id, user_id) 保证只有一条，读回胜出的那条
            Conversation winner = conversationService.findByAnalysisAndUser(analysisId, userId);
            if (winner == null) {
                throw e;
            }
            return new ConversationHandle(winner, false);
        }
        log.info("Conversation created: conversationId={}, analysisId={}, userId={}", conversation.getId(), analysisId, userId);
        return new ConversationHandle(conversation, true);
    }

    @Override
    public Conversation getConversation(String conversationId) {
        return conversationService.getById(conversationId);
    }

    // ==================== 消息 ====================

    @Override
    public Message appendMessage(Message message) {
        if (message.getId() == null) {
            message.setId(IdSupport.newId("msg_"));
        }
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(LocalDateTime.now());
        }
        for (int attempt = 1; ; attempt++) {
            message.setSequence(messageService.maxSequence(message.getConversationId()) + 1);
            try {
                messageService.save(message);
                break;
            } catch (DuplicateKeyException e) {
                if (attempt >= SEQUENCE_RETRIES) {
                    throw e;
                }
                log.warn("Message sequence conflict, retrying: conversationId={}, attempt={}",
                        message.getConversationId(), attempt);
            }
        }
        conversationService.lambdaUpdate()
                .eq(Conversation::getId, message.getConversationId())
                .set(Conversation::getUpdatedAt, message.getCreatedAt())
                .update();
        return message;
    }

    @Override
    @Transactional
    public void appendExchange(Message userMessage, Message assistantMessage) {
        appendMessage(userMessage);
        appendMessage(assistantMessage);
    }

    @Override
    public void updateMessage(Message message) {
        messageService.updateById(message);
    }

    @Override
    public Message getMessage(String messageId) {
        return messageService.getById(messageId);
    }

    @Override
    public List<Message> getRecentMessages(String conversationId, int limit) {
        List<Message> newestFirst = messageService.lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByDesc(Message::getSequence)
                .last("LIMIT " + Math.max(0, limit))
                .list();
        List<Message> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    @Override
    public List<Message> getMessages(String conversationId, int limit, int offset) {
        return messageService.lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .orderByAsc(Message::getSequence)
                .last("LIMIT " + Math.max(0, limit) + " OFFSET " + Math.max(0, offset))
                .list();
    }

    @Override
    public long countMessages(String conversationId) {
        return messageService.lambdaQuery()
                .eq(Message::getConversationId, conversationId)
                .count();
    }

    @Override
    @Transactional
    public void clearConversation(String conversationId) {
        messageService.lambdaUpdate().eq(Message::getConversationId, conversationId).remove();
        suggestedQuestionService.lambdaUpdate().eq(SuggestedQuestion::getConversationId, conversationId).remove();
        analyticsMapper.deleteById(conversationId);
        conversationService.lambdaUpdate()
                .eq(Conversation::getId, conversationId)
                .set(Conversation::getUpdatedAt, LocalDateTime.now())
                .update();
    }

    // ==================== 推荐问题 ====================

    @Override
    public List<SuggestedQuestion> getSuggestedQuestions(String conversationId, boolean includeUsed) {
        return suggestedQuestionService.lambdaQuery()
                .eq(SuggestedQuestion::getConversationId, conversationId)
                .eq(!includeUsed, SuggestedQuestion::getUsed, false)
                .orderByDesc(SuggestedQuestion::getPriority)
                .orderByAsc(SuggestedQuestion::getCreatedAt)
                .list();
    }

    @Override
    @Transactional
    public List<SuggestedQuestion> replaceSuggestedQuestions(String conversationId, List<SuggestedQuestion> questions) {
        suggestedQuestionService.lambdaUpdate()
                .eq(SuggestedQuestion::getConversationId, conversationId)
                .eq(SuggestedQuestion::getUsed, false)
                .remove();
        LocalDateTime now = LocalDateTime.now();
        for (SuggestedQuestion q : questions) {
            if (q.getId() == null) {
                q.setId(IdSupport.newId("sq_"));
            }
            q.setConversationId(conversationId);
            q.setUsed(false);
            q.setCreatedAt(now);
        }
        if (!questions.isEmpty()) {
            suggestedQuestionService.saveBatch(questions);
        }
        return getSuggestedQuestions(conversationId, false);
    }

    @Override
    public SuggestedQuestion getSuggestedQuestion(String questionId) {
        return suggestedQuestionService.getById(questionId);
    }

    @Override
    public void markSuggestionUsed(String questionId) {
        suggestedQuestionService.lambdaUpdate()
                .eq(SuggestedQuestion::getId, questionId)
                .set(SuggestedQuestion::getUsed, true)
                .update();
    }

    // ==================== 统计 ====================

    @Override
    public ConversationAnalytics getAnalytics(String conversationId) {
        ConversationAnalytics analytics = analyticsMapper.selectById(conversationId);
        return analytics != null ? analytics : ConversationAnalytics.empty(conversationId);
    }

    @Override
    public void recordExchange(String conversationId, int tokensUsed, long processingTimeMs) {
        ensureAnalyticsRow(conversationId);
        // 先算平均值再自增 response_count：MySQL 的 SET 按书写顺序求值
        analyticsMapper.update(null, new LambdaUpdateWrapper<ConversationAnalytics>()
                .eq(ConversationAnalytics::getConversationId, conversationId)
                .setSql("avg_response_time_ms = (avg_response_time_ms * response_count + {0}) / (response_count + 1)",
                        processingTimeMs)
                .setSql("response_count = response_count + 1")
                .setSql("message_count = message_count + 2")
                .setSql("total_tokens_used = total_tokens_used + {0}", Math.max(0, tokensUsed))
                .set(ConversationAnalytics::getUpdatedAt, LocalDateTime.now()));
    }

    @Override
    @Transactional
    public boolean rateMessage(String messageId, String conversationId, int rating, String feedback) {
        // rating IS NULL 作为条件：并发的首次评分只有一条 UPDATE 命中
        boolean first = messageService.lambdaUpdate()
                .eq(Message::getId, messageId)
                .isNull(Message::getRating)
                .set(Message::getRating, rating)
                .set(Message::getRatingFeedback, feedback)
                .update();
        if (!first) {
            messageService.lambdaUpdate()
                    .eq(Message::getId, messageId)
                    .set(Message::getRating, rating)
                    .set(Message::getRatingFeedback, feedback)
                    .update();
            return false;
        }
        recordRating(conversationId, rating);
        return true;
    }

    private void recordRating(String conversationId, int rating) {
        ensureAnalyticsRow(conversationId);
        analyticsMapper.update(null, new LambdaUpdateWrapper<ConversationAnalytics>()
                .eq(ConversationAnalytics::getConversationId, conversationId)
                .setSql("user_satisfaction = (COALESCE(user_satisfaction, 0) * rating_count + {0}) / (rating_count + 1)",
                        rating)
                .setSql("rating_count = rating_count + 1")
                .set(ConversationAnalytics::getUpdatedAt, LocalDateTime.now()));
    }

    private void ensureAnalyticsRow(String conversationId) {
        if (analyticsMapper.selectById(conversationId) != null) {
            return;
        }
        try {
            analyticsMapper.insert(ConversationAnalytics.empty(conversationId));
        } catch (DuplicateKeyException e) {
            log.debug("Analytics row created concurrently: conversationId={}", conversationId);
        }
    }

    // ==================== 变体与举报 ====================

    @Override
    public ConversationVariant addVariant(ConversationVariant variant) {
        if (variant.getId() == null) {
            variant.setId(IdSupport.newId("cv_"));
        }
        if (variant.getCreatedAt() == null) {
            variant.setCreatedAt(LocalDateTime.now());
        }
        variantMapper.insert(variant);
        return variant;
    }

    @Override
    public List<ConversationVariant> getVariants(String conversationId) {
        return variantMapper.selectList(new LambdaQueryWrapper<ConversationVariant>()
                .eq(ConversationVariant::getConversationId, conversationId)
                .orderByAsc(ConversationVariant::getCreatedAt));
    }

    @Override
    public MessageReport saveReport(MessageReport report) {
        if (report.getId() == null) {
            report.setId(IdSupport.newId("rpt_"));
        }
        reportMapper.insert(report);
        return report;
    }

    @Override
    public long countReportsSince(String userId, LocalDateTime since) {
        Long count = reportMapper.selectCount(new LambdaQueryWrapper<MessageReport>()
                .eq(MessageReport::getReportedBy, userId)
                .ge(MessageReport::getCreatedAt, since));
        return count != null ? count : 0L;
    }
}
