package com.imperium.unbuilt.ai.context;

import java.util.List;

/**
 * 一次生成所用的上下文：分析摘要、历史（时间正序）、当前问题，以及各段的 token 估算。
 * <p>
 * 当前问题永远原样保留；历史是最近消息的连续后缀；摘要只在预算不足时被截断。
 *
 * @param analysisContext   渲染后的分析摘要，可能已被截断
 * @param history           保留下来的历史，时间正序
 * @param currentQuery      当前问题，原文
 * @param droppedTurns      因预算被丢弃的较早历史条数
 * @param analysisTruncated 摘要是否被截断
 */
public record ContextWindow(String analysisContext,
                            List<ContextTurn> history,
                            String currentQuery,
                            int analysisTokens,
                            int historyTokens,
                            int queryTokens,
                            int maxTokens,
                            int droppedTurns,
                            boolean analysisTruncated) {

    public int totalTokens() {
        return analysisTokens + historyTokens + queryTokens;
    }
}
