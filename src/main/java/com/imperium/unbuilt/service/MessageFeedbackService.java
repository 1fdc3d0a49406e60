package com.imperium.unbuilt.service;

import com.imperium.unbuilt.exception.ReportThrottledException;
import com.imperium.unbuilt.exception.ResourceNotFoundException;
import com.imperium.unbuilt.exception.ValidationFailedException;
import com.imperium.unbuilt.guard.ContentModerator;
import com.imperium.unbuilt.guard.GuardContext;
import com.imperium.unbuilt.guard.MessageReportCommand;
import com.imperium.unbuilt.guard.ReportAbuseCheck;
import com.imperium.unbuilt.guard.ReportResult;
import com.imperium.unbuilt.model.dto.response.MessageDto;
import com.imperium.unbuilt.model.dto.response.ReportResponse;
import com.imperium.unbuilt.model.entity.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 对 assistant 消息的评分与举报。
 */
@Service
public class MessageFeedbackService {

    private static final Logger log = LoggerFactory.getLogger(MessageFeedbackService.class);

    public static final int MAX_FEEDBACK_LENGTH = 500;

    private final ConversationStore store;
    private final ConversationAccess access;
    private final ContentModerator contentModerator;

    public MessageFeedbackService(ConversationStore store, ConversationAccess access, ContentModerator contentModerator) {
        this.store = store;
        this.access = access;
        this.contentModerator = contentModerator;
    }

    /**
     * 评分 1~5。只有首次评分计入会话满意度均值，重复评分只更新消息本身。
     */
    public MessageDto rateMessage(String messageId, String userId, int rating, String feedback) {
        if (rating < 1 || rating > 5) {
            throw new ValidationFailedException("Rating must be between 1 and 5");
        }
        if (feedback != null && feedback.length() > MAX_FEEDBACK_LENGTH) {
            throw new ValidationFailedException("Feedback must be at most " + MAX_FEEDBACK_LENGTH + " characters");
        }
        Message message = requireOwnedAssistantMessage(messageId, userId, "rated");

        boolean firstRating = store.rateMessage(messageId, message.getConversationId(), rating, feedback);
        message.setRating(rating);
        message.setRatingFeedback(feedback);
        log.info("Message rated: messageId={}, conversationId={}, rating={}, first={}",
                messageId, message.getConversationId(), rating, firstRating);
        return MessageDto.from(message);
    }

    public ReportResponse reportMessage(MessageReportCommand command, GuardContext ctx) {
        ReportAbuseCheck abuse = contentModerator.checkReportAbuse(command.reportedBy());
        if (abuse.abusive()) {
            throw new ReportThrottledException(abuse.reportCount());
        }
        Message message = requireOwnedAssistantMessage(command.messageId(), command.reportedBy(), "reported");

        GuardContext reportCtx = new GuardContext(ctx.userId(), message.getConversationId(), ctx.ipAddress(), ctx.userAgent());
        ReportResult result = contentModerator.reportMessage(command, reportCtx);
        if (!result.success()) {
            throw new ResourceNotFoundException("Message not found");
        }
        return new ReportResponse(result.reportId(), "pending",
                "Thank you for your report. Our team will review it shortly.");
    }

    private Message requireOwnedAssistantMessage(String messageId, String userId, String action) {
        Message message = store.getMessage(messageId);
        if (message == null) {
            throw new ResourceNotFoundException("Message not found");
        }
        access.requireOwned(message.getConversationId(), userId);
        if (!message.isAssistant()) {
            throw new ValidationFailedException("Only assistant messages can be " + action);
        }
        return message;
    }
}
