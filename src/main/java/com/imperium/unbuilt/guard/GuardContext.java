package com.imperium.unbuilt.guard;

/**
 * 安全日志所需的请求上下文。
 */
public record GuardContext(String userId, String conversationId, String ipAddress, String userAgent) {

    public static GuardContext of(String userId, String conversationId) {
        return new GuardContext(userId, conversationId, null, null);
    }
}
