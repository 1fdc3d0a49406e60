package com.imperium.unbuilt.ai.context;

/**
 * 进入上下文窗口的一条历史消息。role 为 user 或 assistant。
 */
public record ContextTurn(String role, String content, int tokens) {
}
