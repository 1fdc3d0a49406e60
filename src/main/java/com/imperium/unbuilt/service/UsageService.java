package com.imperium.unbuilt.service;

/**
 * 请求用量记录（成本与耗时）。
 */
public interface UsageService {

    /**
     * 记录一次 assistant 回复的用量；命中去重缓存时 cached=true、token 为 0。
     *
     * @param messageId        assistant 消息 ID
     * @param conversationId   会话 ID
     * @param userId           用户 ID
     * @param model            模型名
     * @param latencyMs        耗时（毫秒）
     * @param promptTokens     请求 token 数（可为 null，表示未统计）
     * @param completionTokens 回复 token 数（可为 null）
     * @param cached           是否命中去重缓存
     */
    void record(String messageId, String conversationId, String userId, String model, int latencyMs,
                Integer promptTokens, Integer completionTokens, boolean cached);

    /** 按每 1K token 单价估算费用（美元） */
    double estimateCostUsd(Integer promptTokens, Integer completionTokens);
}
