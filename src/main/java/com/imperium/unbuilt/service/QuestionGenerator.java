package com.imperium.unbuilt.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.entity.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 推荐问题生成：分类模板 + 可选的 LLM 生成。
 * <p>
 * LLM 返回 JSON 数组 [{"text","category","priority"}]；调用或解析失败时回退到模板。
 */
@Component
public class QuestionGenerator {

    private static final Logger log = LoggerFactory.getLogger(QuestionGenerator.class);

    private static final TypeReference<List<Map<String, Object>>> QUESTION_LIST_TYPE = new TypeReference<>() {};

    /** 与已问过的问题相似度超过该值的候选会被剔除 */
    static final double ASKED_SIMILARITY_CUTOFF = 0.6;

    static final int INITIAL_LIMIT = 5;
    private static final int FOLLOW_UP_CANDIDATES = 12;
    private static final int RECENT_TURNS_FOR_PROMPT = 6;

    private static final Map<QuestionCategory, List<String>> TEMPLATES = new EnumMap<>(QuestionCategory.class);

    static {
        TEMPLATES.put(QuestionCategory.MARKET_VALIDATION, List.of(
                "How can I validate real demand for {gap} before building anything?",
                "Who are the first customers most likely to pay for {gap}?",
                "What is the realistic market size for {gap}, and how fast is it growing?",
                "Which signals would show that {gap} is a real problem worth solving?"));
        TEMPLATES.put(QuestionCategory.COMPETITIVE_ANALYSIS, List.of(
                "Why hasn't an existing company already solved {gap}?",
                "How could I differentiate from current alternatives to {gap}?",
                "Which competitors are closest to addressing {gap}, and where are they weak?"));
        TEMPLATES.put(QuestionCategory.EXECUTION_STRATEGY, List.of(
                "What would a minimum viable product for {gap} look like?",
                "What are the first three steps to start working on {gap}?",
                "Which pricing model fits {gap} best?",
                "What skills or partners do I need to launch {gap}?"));
        TEMPLATES.put(QuestionCategory.RISK_ASSESSMENT, List.of(
                "What are the biggest risks in pursuing {gap}?",
                "Are there regulatory or legal hurdles for {gap}?",
                "What could make {gap} fail even if the demand is real?"));
    }

    private static final Map<QuestionCategory, Integer> BASE_PRIORITY = Map.of(
            QuestionCategory.MARKET_VALIDATION, 80,
            QuestionCategory.COMPETITIVE_ANALYSIS, 70,
            QuestionCategory.EXECUTION_STRATEGY, 65,
            QuestionCategory.RISK_ASSESSMENT, 60);

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    @Value("${app.suggestions.ai-enabled:false}")
    private boolean aiEnabled;

    public QuestionGenerator(ChatClient chatClient, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
    }

    // ==================== 初始问题 ====================

    /**
     * 新会话的初始问题：市场验证 2 个，竞争、执行、风险各 1 个；可行性低时风险 2 个。按优先级取前 5。
     */
    public List<GeneratedQuestion> initialQuestions(AnalysisSummary summary) {
        String gap = primaryGap(summary);
        boolean lowFeasibility = "low".equalsIgnoreCase(summary != null ? summary.getFeasibilityRating() : null);
        boolean highInnovation = summary != null && summary.getInnovationScore() != null && summary.getInnovationScore() > 80;

        Map<QuestionCategory, Integer> counts = new EnumMap<>(QuestionCategory.class);
        counts.put(QuestionCategory.MARKET_VALIDATION, 2);
        counts.put(QuestionCategory.COMPETITIVE_ANALYSIS, 1);
        counts.put(QuestionCategory.EXECUTION_STRATEGY, 1);
        counts.put(QuestionCategory.RISK_ASSESSMENT, lowFeasibility ? 2 : 1);

        List<GeneratedQuestion> questions = new ArrayList<>();
        for (Map.Entry<QuestionCategory, Integer> entry : counts.entrySet()) {
            QuestionCategory category = entry.getKey();
            List<String> templates = TEMPLATES.get(category);
            for (int i = 0; i < Math.min(entry.getValue(), templates.size()); i++) {
                int priority = BASE_PRIORITY.get(category) - i * 5;
                if (category == QuestionCategory.RISK_ASSESSMENT && lowFeasibility) {
                    priority += 15;
                }
                if (category == QuestionCategory.MARKET_VALIDATION && highInnovation) {
                    priority += 10;
                }
                questions.add(new GeneratedQuestion(fill(templates.get(i), gap), category, Math.min(100, priority)));
            }
        }
        return questions.stream()
                .sorted(Comparator.comparingInt(GeneratedQuestion::priority).reversed())
                .limit(INITIAL_LIMIT)
                .toList();
    }

    // ==================== 追问候选 ====================

    /**
     * 基于分析与对话历史生成追问候选（未排序、未截断），已问过的相似问题被剔除。
     */
    public List<GeneratedQuestion> followUpQuestions(AnalysisSummary summary, List<Message> history) {
        List<String> asked = history == null ? List.of() : history.stream()
                .filter(Message::isUser)
                .map(Message::getContent)
                .toList();

        List<GeneratedQuestion> candidates = aiEnabled && chatClient != null ? generateWithModel(summary, history) : List.of();
        if (candidates.isEmpty()) {
            candidates = fromTemplates(summary);
        }

        Set<String> seen = new LinkedHashSet<>();
        List<GeneratedQuestion> result = new ArrayList<>();
        for (GeneratedQuestion q : candidates) {
            if (!seen.add(q.text().toLowerCase())) {
                continue;
            }
            boolean alreadyAsked = asked.stream()
                    .anyMatch(a -> QueryDeduplicationCache.calculateSimilarity(a, q.text()) > ASKED_SIMILARITY_CUTOFF);
            if (!alreadyAsked) {
                result.add(q);
            }
        }
        return result;
    }

    private List<GeneratedQuestion> fromTemplates(AnalysisSummary summary) {
        List<String> gaps = new ArrayList<>();
        if (summary != null && summary.hasGaps()) {
            summary.getTopGaps().stream().limit(3).map(GapSummary::getTitle).forEach(gaps::add);
        }
        if (gaps.isEmpty()) {
            gaps.add(primaryGap(summary));
        }
        List<GeneratedQuestion> candidates = new ArrayList<>();
        for (Map.Entry<QuestionCategory, List<String>> entry : TEMPLATES.entrySet()) {
            List<String> templates = entry.getValue();
            for (int i = 0; i < templates.size(); i++) {
                String gap = gaps.get(i % gaps.size());
                candidates.add(new GeneratedQuestion(fill(templates.get(i), gap), entry.getKey(),
                        BASE_PRIORITY.get(entry.getKey()) - i * 5));
            }
        }
        return candidates.stream().limit(FOLLOW_UP_CANDIDATES * 2L).toList();
    }

    private List<GeneratedQuestion> generateWithModel(AnalysisSummary summary, List<Message> history) {
        String systemPrompt = "You suggest follow-up questions for an entrepreneur exploring a market gap analysis. "
                + "Reply with a JSON array only, no markdown. Each item: "
                + "{\"text\":\"question\", \"category\":\"market_validation|competitive_analysis|execution_strategy|risk_assessment\", "
                + "\"priority\":0-100}. Suggest " + FOLLOW_UP_CANDIDATES + " short, specific questions the user has not asked yet.";
        StringBuilder userPrompt = new StringBuilder();
        if (summary != null) {
            userPrompt.append("Search: ").append(summary.getSearchQuery()).append('\n');
            if (summary.hasGaps()) {
                userPrompt.append("Top gaps: ");
                summary.getTopGaps().stream().limit(3).forEach(g -> userPrompt.append(g.getTitle()).append("; "));
                userPrompt.append('\n');
            }
        }
        if (history != null && !history.isEmpty()) {
            userPrompt.append("Recent conversation:\n");
            history.stream()
                    .skip(Math.max(0, history.size() - RECENT_TURNS_FOR_PROMPT))
                    .forEach(m -> userPrompt.append(m.getRole()).append(": ").append(abbreviate(m.getContent())).append('\n'));
        }

        String response;
        try {
            response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt.toString())
                    .call()
                    .content();
        } catch (RuntimeException e) {
            log.warn("Suggestion generation failed, falling back to templates: {}", e.getMessage());
            return List.of();
        }
        return parseQuestions(response);
    }

    List<GeneratedQuestion> parseQuestions(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String json = content.trim();
        int start = json.indexOf('[');
        int end = json.lastIndexOf(']') + 1;
        if (start < 0 || end <= start) {
            log.warn("Suggestion response is not a JSON array, falling back to templates");
            return List.of();
        }
        json = json.substring(start, end);
        List<Map<String, Object>> items;
        try {
            items = objectMapper.readValue(json, QUESTION_LIST_TYPE);
        } catch (Exception e) {
            log.warn("Failed to parse suggestion response, falling back to templates: {}", e.getMessage());
            return List.of();
        }
        List<GeneratedQuestion> questions = new ArrayList<>();
        for (Map<String, Object> item : items) {
            Object text = item.get("text");
            QuestionCategory category = QuestionCategory.fromCode(String.valueOf(item.get("category")));
            if (text == null || String.valueOf(text).isBlank() || category == null) {
                continue;
            }
            int priority = item.get("priority") instanceof Number n ? n.intValue() : BASE_PRIORITY.get(category);
            questions.add(new GeneratedQuestion(String.valueOf(text).trim(), category, Math.max(0, Math.min(100, priority))));
        }
        return questions;
    }

    private static String primaryGap(AnalysisSummary summary) {
        if (summary != null && summary.hasGaps() && summary.getTopGaps().get(0).getTitle() != null) {
            return summary.getTopGaps().get(0).getTitle();
        }
        if (summary != null && summary.getSearchQuery() != null && !summary.getSearchQuery().isBlank()) {
            return summary.getSearchQuery();
        }
        return "this opportunity";
    }

    private static String fill(String template, String gap) {
        return template.replace("{gap}", gap);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
