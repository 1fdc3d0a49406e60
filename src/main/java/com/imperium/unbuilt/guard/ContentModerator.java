package com.imperium.unbuilt.guard;

import com.imperium.unbuilt.config.IdSupport;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.model.entity.MessageReport;
import com.imperium.unbuilt.service.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 第三道防线：内容审核，以及用户举报与举报滥用节流。
 * <p>
 * 审核通过条件：严重度 LOW，或 MEDIUM 且不需要人工复核。
 */
@Component
public class ContentModerator {

    private static final Logger log = LoggerFactory.getLogger(ContentModerator.class);
    private static final Logger securityLog = LoggerFactory.getLogger("security");

    public static final String USER_MESSAGE =
            "Your message contains inappropriate content. Please keep conversations professional and respectful.";

    private final TextClassifier classifier;
    private final ConversationStore conversationStore;
    private final Clock clock;

    @Value("${app.moderation.report.max-per-window:10}")
    private int maxReportsPerWindow = 10;

    @Value("${app.moderation.report.window:PT1H}")
    private Duration reportWindow = Duration.ofHours(1);

    public ContentModerator(@Qualifier("moderationClassifier") TextClassifier moderationClassifier,
                            ConversationStore conversationStore,
                            Clock clock) {
        this.classifier = moderationClassifier;
        this.conversationStore = conversationStore;
        this.clock = clock;
    }

    public ModerationResult moderateUserInput(String text, String userId, GuardContext ctx) {
        ClassifierVerdict verdict = classifier.classify(text);
        Severity severity = verdict.severity();
        boolean approved = severity == Severity.LOW
                || (severity == Severity.MEDIUM && !verdict.requiresReview());
        ModerationResult result = new ModerationResult(approved, severity, verdict.categories(), verdict.requiresReview());
        if (!approved) {
            securityLog.warn("Content rejected by moderation: userId={}, conversationId={}, severity={}, categories={}, preview=\"{}\"",
                    userId, ctx.conversationId(), severity.code(), verdict.categories(), InputGuard.preview(text));
        } else if (verdict.flagged()) {
            log.info("Content flagged but approved: userId={}, conversationId={}, categories={}",
                    userId, ctx.conversationId(), verdict.categories());
        }
        return result;
    }

    /**
     * 保存举报并标记消息。消息不存在时返回 success=false。
     */
    public ReportResult reportMessage(MessageReportCommand report, GuardContext ctx) {
        Message message = conversationStore.getMessage(report.messageId());
        if (message == null) {
            log.info("Report for unknown message: messageId={}, reportedBy={}", report.messageId(), report.reportedBy());
            return ReportResult.failed();
        }

        MessageReport row = new MessageReport();
        row.setId(IdSupport.newId("rpt_"));
        row.setMessageId(message.getId());
        row.setConversationId(message.getConversationId());
        row.setReportedBy(report.reportedBy());
        row.setCategory(report.category());
        row.setReason(report.reason());
        row.setDetails(report.details());
        row.setStatus("pending");
        row.setCreatedAt(LocalDateTime.now(clock));
        MessageReport saved = conversationStore.saveReport(row);

        message.setFlagged(true);
        conversationStore.updateMessage(message);

        securityLog.warn("Message reported: reportId={}, messageId={}, conversationId={}, reportedBy={}, category={}, ip={}",
                saved.getId(), message.getId(), message.getConversationId(), report.reportedBy(),
                report.category(), ctx.ipAddress());
        return new ReportResult(true, saved.getId());
    }

    /**
     * 统计窗口内该用户提交的举报数，达到上限即视为滥用。
     */
    public ReportAbuseCheck checkReportAbuse(String userId) {
        LocalDateTime since = LocalDateTime.now(clock).minus(reportWindow);
        long count = conversationStore.countReportsSince(userId, since);
        boolean abusive = count >= maxReportsPerWindow;
        if (abusive) {
            securityLog.warn("Report abuse throttled: userId={}, reportsInWindow={}", userId, count);
        }
        return new ReportAbuseCheck(abusive, count);
    }
}
