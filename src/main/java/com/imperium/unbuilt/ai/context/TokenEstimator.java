package com.imperium.unbuilt.ai.context;

/**
 * token 数估算。实现需满足单调性：文本变长，估算值不减。
 */
public interface TokenEstimator {

    int estimate(String text);

    /**
     * 截断到不超过 maxTokens，末尾追加 "..."。已在预算内则原样返回；预算为 0 返回空串。
     */
    default String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty() || estimate(text) <= maxTokens) {
            return text == null ? "" : text;
        }
        if (maxTokens <= 0 || estimate("...") > maxTokens) {
            return "";
        }
        int low = 0;
        int high = text.length();
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (estimate(text.substring(0, mid) + "...") <= maxTokens) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return text.substring(0, low) + "...";
    }
}
