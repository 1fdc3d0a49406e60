package com.imperium.unbuilt.service;

/**
 * 去重缓存统计。costSavingsUsd 按每次命中节省一次平均生成成本估算。
 */
public record DeduplicationStats(long totalQueries, long cacheHits, long cacheMisses,
                                 double hitRate, double costSavingsUsd) {
}
