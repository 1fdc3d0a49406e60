package com.imperium.unbuilt.ai.orchestrator;

import com.imperium.unbuilt.policy.SubscriptionTier;

/**
 * 一次“发送消息”请求。
 *
 * @param analysisId      会话所属分析
 * @param userId          调用方
 * @param tier            归一化后的订阅档位
 * @param content         原始消息文本
 * @param streamRequested 是否请求流式（仅付费档位生效）
 */
public record MessageCommand(String analysisId, String userId, SubscriptionTier tier, String content,
                             boolean streamRequested, String ipAddress, String userAgent) {
}
