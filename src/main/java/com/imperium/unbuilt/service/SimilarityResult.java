package com.imperium.unbuilt.service;

/**
 * 去重查询结果。similar=false 时 cachedResponse 为 null，similarity 仍为最高相似度。
 */
public record SimilarityResult(boolean similar, double similarity, String matchedQuery, String cachedResponse) {

    public static SimilarityResult miss(double bestSimilarity) {
        return new SimilarityResult(false, bestSimilarity, null, null);
    }
}
