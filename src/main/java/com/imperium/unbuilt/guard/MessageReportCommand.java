package com.imperium.unbuilt.guard;

/**
 * 用户对 assistant 消息的举报。
 */
public record MessageReportCommand(String messageId, String reportedBy, String category,
                                   String reason, String details) {
}
