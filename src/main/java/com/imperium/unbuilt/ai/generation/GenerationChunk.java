package com.imperium.unbuilt.ai.generation;

/**
 * 流式生成的一个分片。提供商在最后一个分片上附带 usage 时，promptTokens / completionTokens 非空。
 */
public record GenerationChunk(String text, Integer promptTokens, Integer completionTokens) {

    public static GenerationChunk text(String text) {
        return new GenerationChunk(text, null, null);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
