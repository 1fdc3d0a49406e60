package com.imperium.unbuilt.ai.context;

/**
 * 按字符数近似：约 4 个字符一个 token，向上取整。
 * 对英文大致准确，对中文等会低估，只用于预算控制，计费以提供商返回的 usage 为准。
 */
public class CharacterTokenEstimator implements TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    @Override
    public String truncate(String text, int maxTokens) {
        if (text == null) {
            return "";
        }
        if (estimate(text) <= maxTokens) {
            return text;
        }
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        if (maxChars < 3) {
            return "";
        }
        return text.substring(0, maxChars - 3) + "...";
    }
}
