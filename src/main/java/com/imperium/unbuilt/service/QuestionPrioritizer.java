package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.entity.Message;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 推荐问题打分排序。
 * <p>
 * 总分 = 相关度 40% + 用户关注 30% + 知识空白 20% + 可操作性 10%，各项 0~100。
 */
@Component
public class QuestionPrioritizer {

    static final double RELEVANCE_WEIGHT = 0.40;
    static final double USER_CONCERNS_WEIGHT = 0.30;
    static final double KNOWLEDGE_GAPS_WEIGHT = 0.20;
    static final double ACTIONABILITY_WEIGHT = 0.10;

    public static final int DEFAULT_LIMIT = 5;

    private static final Map<QuestionCategory, List<String>> CATEGORY_KEYWORDS = new EnumMap<>(QuestionCategory.class);

    static {
        CATEGORY_KEYWORDS.put(QuestionCategory.MARKET_VALIDATION, List.of("market", "demand", "customer", "audience", "pricing"));
        CATEGORY_KEYWORDS.put(QuestionCategory.COMPETITIVE_ANALYSIS, List.of("competitor", "competition", "advantage", "threat"));
        CATEGORY_KEYWORDS.put(QuestionCategory.EXECUTION_STRATEGY, List.of("build", "launch", "mvp", "team", "resource"));
        CATEGORY_KEYWORDS.put(QuestionCategory.RISK_ASSESSMENT, List.of("risk", "challenge", "fail", "regulatory"));
    }

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "market", "customer", "demand", "pricing", "revenue",
            "competitor", "competition", "advantage", "threat",
            "build", "launch", "mvp", "team", "resource",
            "risk", "challenge", "regulatory", "capital");

    private static final List<String> ACTION_KEYWORDS = List.of(
            "how", "what", "when", "where", "who", "should", "would", "could", "can",
            "first step", "start", "begin", "launch", "validate", "test", "measure", "track",
            "build", "create", "develop", "implement");

    private static final List<String> OUTCOME_KEYWORDS = List.of(
            "validate", "test", "measure", "calculate", "determine", "identify");

    private static final List<String> UNCERTAINTY_MARKERS = List.of(
            "not sure", "unclear", "confused", "don't understand", "?");

    /** 打分后按总分降序取前 limit 个，priority 被替换为总分 */
    public List<GeneratedQuestion> prioritize(List<GeneratedQuestion> questions, AnalysisSummary summary,
                                              List<Message> history, int limit) {
        List<Message> safeHistory = history == null ? List.of() : history;
        return questions.stream()
                .map(q -> q.withPriority(score(q, summary, safeHistory).total()))
                .sorted(Comparator.comparingInt(GeneratedQuestion::priority).reversed())
                .limit(limit)
                .toList();
    }

    public PriorityScore score(GeneratedQuestion question, AnalysisSummary summary, List<Message> history) {
        double relevance = relevance(question, summary);
        double concerns = userConcerns(question, history);
        double gaps = knowledgeGaps(question, history);
        double action = actionability(question);
        double total = relevance * RELEVANCE_WEIGHT
                + concerns * USER_CONCERNS_WEIGHT
                + gaps * KNOWLEDGE_GAPS_WEIGHT
                + action * ACTIONABILITY_WEIGHT;
        return new PriorityScore((int) Math.round(total), (int) Math.round(relevance), (int) Math.round(concerns),
                (int) Math.round(gaps), (int) Math.round(action));
    }

    // ---------- 相关度 ----------

    private double relevance(GeneratedQuestion question, AnalysisSummary summary) {
        double score = 50;
        if (summary == null) {
            return score;
        }
        Integer innovation = summary.getInnovationScore();
        String feasibility = summary.getFeasibilityRating();
        QuestionCategory category = question.category();

        if (innovation != null) {
            if (category == QuestionCategory.MARKET_VALIDATION && innovation > 80) {
                score += 15;
            }
            if (category == QuestionCategory.COMPETITIVE_ANALYSIS && innovation > 70) {
                score += 10;
            }
        }
        if ("high".equalsIgnoreCase(feasibility) && category == QuestionCategory.EXECUTION_STRATEGY) {
            score += 15;
        }
        if ("low".equalsIgnoreCase(feasibility) && category == QuestionCategory.RISK_ASSESSMENT) {
            score += 20;
        }
        if (summary.hasGaps() && summary.getTopGaps().get(0).getTitle() != null) {
            Set<String> gapWords = new HashSet<>(QueryDeduplicationCache.tokenize(summary.getTopGaps().get(0).getTitle()));
            long overlap = QueryDeduplicationCache.tokenize(question.text()).stream().distinct().filter(gapWords::contains).count();
            score += overlap * 5;
        }
        return Math.min(100, score);
    }

    // ---------- 用户关注 ----------

    private double userConcerns(GeneratedQuestion question, List<Message> history) {
        List<String> userTexts = userTexts(history);
        if (userTexts.isEmpty()) {
            return 50;
        }
        double score = 40;
        int focus = 0;
        for (String text : userTexts) {
            for (String keyword : CATEGORY_KEYWORDS.get(question.category())) {
                if (text.contains(keyword)) {
                    focus++;
                }
            }
        }
        score += focus * 5;
        boolean askedSimilar = userTexts.stream()
                .anyMatch(t -> QueryDeduplicationCache.calculateSimilarity(t, question.text()) > 0.3);
        if (askedSimilar) {
            score += 20;
        }
        return Math.min(100, score);
    }

    // ---------- 知识空白 ----------

    private double knowledgeGaps(GeneratedQuestion question, List<Message> history) {
        double score = 50;
        Set<String> discussed = new HashSet<>();
        int categoryMentions = 0;
        boolean uncertain = false;
        for (Message m : history) {
            String content = lower(m.getContent());
            TOPIC_KEYWORDS.stream().filter(content::contains).forEach(discussed::add);
            if (CATEGORY_KEYWORDS.get(question.category()).stream().anyMatch(content::contains)) {
                categoryMentions++;
            }
            if (UNCERTAINTY_MARKERS.stream().anyMatch(content::contains)) {
                uncertain = true;
            }
        }
        long newTopics = QueryDeduplicationCache.tokenize(question.text()).stream()
                .distinct()
                .filter(TOPIC_KEYWORDS::contains)
                .filter(t -> !discussed.contains(t))
                .count();
        score += newTopics * 15;
        if (categoryMentions == 0) {
            score += 25;
        } else if (categoryMentions < 2) {
            score += 15;
        }
        if (uncertain) {
            score += 10;
        }
        return Math.min(100, score);
    }

    // ---------- 可操作性 ----------

    private double actionability(GeneratedQuestion question) {
        double score = 50;
        String text = lower(question.text());
        for (String keyword : ACTION_KEYWORDS) {
            if (text.contains(keyword)) {
                score += 5;
            }
        }
        int words = text.trim().isEmpty() ? 0 : text.trim().split("\\s+").length;
        if (words >= 8 && words <= 20) {
            score += 15;
        } else if (words < 8) {
            score -= 10;
        } else {
            score -= 5;
        }
        if (question.category() == QuestionCategory.EXECUTION_STRATEGY) {
            score += 15;
        } else if (question.category() == QuestionCategory.MARKET_VALIDATION) {
            score += 10;
        }
        for (String keyword : OUTCOME_KEYWORDS) {
            if (text.contains(keyword)) {
                score += 8;
            }
        }
        return Math.max(0, Math.min(100, score));
    }

    private static List<String> userTexts(List<Message> history) {
        return history.stream().filter(Message::isUser).map(m -> lower(m.getContent())).toList();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    /** 分项得分 */
    public record PriorityScore(int total, int relevance, int userConcerns, int knowledgeGaps, int actionability) {
    }
}
