package com.imperium.unbuilt.ai.generation;

/**
 * 生成元数据。tokensIn / tokensOut 优先取提供商返回的 usage，缺失时为估算值。
 */
public record GenerationMetadata(long processingTimeMs, int tokensIn, int tokensOut) {

    public static final GenerationMetadata ZERO = new GenerationMetadata(0, 0, 0);

    public int totalTokens() {
        return tokensIn + tokensOut;
    }
}
