package com.imperium.unbuilt.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.model.entity.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * 重复提问检测：新问题与近期问题足够相似时直接复用已有回答，不再调用生成后端。
 * <p>
 * 相似度 = Jaccard 与词频余弦的均值；均值超过 0.54 时乘以 1.32 放大（封顶 1.0），
 * 使“换个说法”的问题更容易越过阈值。
 * <p>
 * 候选来源：会话历史中最近 10 个 user 提问（紧随其后须有已完成的 assistant 回复），
 * 以及按会话缓存的问答对（每会话有界，长时间不活跃的会话整体淘汰）。
 */
@Component
public class QueryDeduplicationCache {

    private static final Logger log = LoggerFactory.getLogger(QueryDeduplicationCache.class);

    /** 历史中参与比较的 user 提问数 */
    static final int RECENT_USER_TURNS = 10;

    static final double BOOST_FLOOR = 0.54;
    static final double BOOST_FACTOR = 1.32;

    /** 单次生成的平均成本（美元），用于估算节省 */
    static final double AVG_GENERATION_COST_USD = 0.05;

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Cache<String, ConversationWindow> windows;
    private final int windowSize;

    private final LongAdder totalQueries = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();

    public QueryDeduplicationCache(ConversationProperties properties) {
        ConversationProperties.Dedup dedup = properties.getDedup();
        this.windowSize = dedup.getWindowSize();
        this.windows = Caffeine.newBuilder()
                .maximumSize(dedup.getMaxConversations())
                .expireAfterAccess(dedup.getExpireAfterAccess())
                .build();
    }

    // ==================== 查询 ====================

    /**
     * 只在给定历史中查找。
     */
    public SimilarityResult findSimilarQuery(String candidate, List<Message> recentHistory, double threshold) {
        return findSimilarQuery(null, candidate, recentHistory, threshold);
    }

    /**
     * 在历史与该会话的缓存问答对中查找最相似的一条；相同分数时取较新的。
     */
    public SimilarityResult findSimilarQuery(String conversationId, String candidate,
                                             List<Message> history, double threshold) {
        totalQueries.increment();
        Match best = bestInHistory(candidate, history);
        if (conversationId != null) {
            ConversationWindow window = windows.getIfPresent(conversationId);
            if (window != null) {
                for (CachedPair pair : window.snapshot()) {
                    double similarity = calculateSimilarity(candidate, pair.query());
                    if (best == null || similarity >= best.similarity()) {
                        best = new Match(similarity, pair.query(), pair.response());
                    }
                }
            }
        }

        if (best != null && best.similarity() >= threshold) {
            cacheHits.increment();
            log.info("Duplicate query detected: conversationId={}, similarity={}",
                    conversationId, String.format("%.3f", best.similarity()));
            return new SimilarityResult(true, best.similarity(), best.query(), best.response());
        }
        cacheMisses.increment();
        return SimilarityResult.miss(best != null ? best.similarity() : 0.0);
    }

    // ==================== 写入 / 淘汰 ====================

    public void cacheQueryResponse(String query, String response, String conversationId) {
        if (conversationId == null || query == null || response == null || response.isBlank()) {
            return;
        }
        windows.get(conversationId, k -> new ConversationWindow(windowSize)).add(new CachedPair(query, response));
    }

    public void evictConversation(String conversationId) {
        windows.invalidate(conversationId);
    }

    public DeduplicationStats stats() {
        long total = totalQueries.sum();
        long hits = cacheHits.sum();
        long misses = cacheMisses.sum();
        double hitRate = total > 0 ? (double) hits / total : 0.0;
        return new DeduplicationStats(total, hits, misses, hitRate, hits * AVG_GENERATION_COST_USD);
    }

    // ==================== 相似度 ====================

    /**
     * 0~1 的相似度，相同文本为 1.0，任一方没有有效词时为 0。
     */
    public static double calculateSimilarity(String a, String b) {
        List<String> tokensA = tokenize(a);
        List<String> tokensB = tokenize(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }
        double average = (jaccard(tokensA, tokensB) + cosine(tokensA, tokensB)) / 2.0;
        if (average > BOOST_FLOOR) {
            return Math.min(1.0, average * BOOST_FACTOR);
        }
        return average;
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(w -> w.length() > 1)
                .toList();
    }

    private static double jaccard(List<String> a, List<String> b) {
        Set<String> setA = new LinkedHashSet<>(a);
        Set<String> setB = new LinkedHashSet<>(b);
        Set<String> union = new LinkedHashSet<>(setA);
        union.addAll(setB);
        setA.retainAll(setB);
        return union.isEmpty() ? 0.0 : (double) setA.size() / union.size();
    }

    private static double cosine(List<String> a, List<String> b) {
        Map<String, Integer> freqA = frequencies(a);
        Map<String, Integer> freqB = frequencies(b);
        double dot = 0.0;
        for (Map.Entry<String, Integer> e : freqA.entrySet()) {
            dot += e.getValue() * freqB.getOrDefault(e.getKey(), 0);
        }
        double normA = norm(freqA);
        double normB = norm(freqB);
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (normA * normB);
    }

    private static Map<String, Integer> frequencies(List<String> tokens) {
        Map<String, Integer> freq = new HashMap<>();
        for (String t : tokens) {
            freq.merge(t, 1, Integer::sum);
        }
        return freq;
    }

    private static double norm(Map<String, Integer> freq) {
        double sum = 0.0;
        for (int v : freq.values()) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    // ==================== 私有 ====================

    private static Match bestInHistory(String candidate, List<Message> history) {
        if (history == null || history.isEmpty()) {
            return null;
        }
        Match best = null;
        int userTurnsSeen = 0;
        for (int i = history.size() - 1; i >= 0 && userTurnsSeen < RECENT_USER_TURNS; i--) {
            Message m = history.get(i);
            if (m == null || !m.isUser()) {
                continue;
            }
            userTurnsSeen++;
            if (i + 1 >= history.size()) {
                continue;
            }
            Message reply = history.get(i + 1);
            if (reply == null || !reply.isAssistant() || !reply.isCompleted()
                    || reply.getContent() == null || reply.getContent().isBlank()) {
                continue;
            }
            double similarity = calculateSimilarity(candidate, m.getContent());
            // 从新到旧遍历，严格大于才替换，相同分数保留较新的
            if (best == null || similarity > best.similarity()) {
                best = new Match(similarity, m.getContent(), reply.getContent());
            }
        }
        return best;
    }

    private record Match(double similarity, String query, String response) {
    }

    private record CachedPair(String query, String response) {
    }

    /** 单个会话的有界问答窗口 */
    private static final class ConversationWindow {

        private final int capacity;
        private final Deque<CachedPair> pairs = new ArrayDeque<>();

        ConversationWindow(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        synchronized void add(CachedPair pair) {
            pairs.addLast(pair);
            while (pairs.size() > capacity) {
                pairs.pollFirst();
            }
        }

        synchronized List<CachedPair> snapshot() {
            return List.copyOf(pairs);
        }
    }
}
