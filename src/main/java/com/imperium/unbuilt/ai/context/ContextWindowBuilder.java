package com.imperium.unbuilt.ai.context;

import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.entity.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 在 token 预算内组装上下文窗口。
 * <p>
 * 优先级：当前问题（原样） &gt; 分析摘要（必要时截断） &gt; 历史（从最新往前取，遇到放不下的即停止）。
 * 只有已完成的 user / assistant 消息进入历史。系统提示词由生成客户端追加，不计入此预算。
 */
@Component
public class ContextWindowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextWindowBuilder.class);

    /** 摘要里单个缺口描述的 token 上限 */
    private static final int GAP_DESCRIPTION_TOKENS = 100;
    private static final int MAX_SUMMARY_GAPS = 5;
    private static final int MAX_SUMMARY_COMPETITORS = 5;

    private final TokenEstimator tokenEstimator;

    public ContextWindowBuilder(TokenEstimator tokenEstimator) {
        this.tokenEstimator = tokenEstimator;
    }

    public ContextWindow buildContext(AnalysisSummary summary, List<Message> history,
                                      String currentQuery, int maxTokens) {
        String query = currentQuery != null ? currentQuery : "";
        int queryTokens = tokenEstimator.estimate(query);

        // ---------- 1. 摘要：放不下时截断，问题本身不动 ----------
        String analysisContext = renderSummary(summary);
        int available = Math.max(0, maxTokens - queryTokens);
        boolean truncated = false;
        if (tokenEstimator.estimate(analysisContext) > available) {
            analysisContext = tokenEstimator.truncate(analysisContext, available);
            truncated = true;
        }
        int analysisTokens = tokenEstimator.estimate(analysisContext);

        // ---------- 2. 历史：最新优先，保证是连续后缀 ----------
        List<Message> eligible = eligibleTurns(history);
        int remaining = Math.max(0, maxTokens - queryTokens - analysisTokens);
        Deque<ContextTurn> kept = new ArrayDeque<>();
        int historyTokens = 0;
        for (int i = eligible.size() - 1; i >= 0; i--) {
            Message m = eligible.get(i);
            int tokens = tokenEstimator.estimate(m.getContent());
            if (historyTokens + tokens > remaining) {
                break;
            }
            kept.addFirst(new ContextTurn(m.getRole(), m.getContent(), tokens));
            historyTokens += tokens;
        }
        int dropped = eligible.size() - kept.size();

        if (truncated || dropped > 0) {
            log.debug("Context trimmed: maxTokens={}, queryTokens={}, analysisTokens={}, analysisTruncated={}, droppedTurns={}",
                    maxTokens, queryTokens, analysisTokens, truncated, dropped);
        }
        return new ContextWindow(analysisContext, List.copyOf(kept), query,
                analysisTokens, historyTokens, queryTokens, maxTokens, dropped, truncated);
    }

    /**
     * 将分析摘要渲染为提示词中的 ANALYSIS CONTEXT 段。
     */
    public String renderSummary(AnalysisSummary summary) {
        if (summary == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder("ANALYSIS CONTEXT:\n\n");
        if (summary.getSearchQuery() != null) {
            sb.append("Original Search: ").append(summary.getSearchQuery()).append("\n\n");
        }
        if (summary.getInnovationScore() != null) {
            sb.append("Innovation Score: ").append(summary.getInnovationScore()).append("/100\n");
        }
        if (summary.getFeasibilityRating() != null) {
            sb.append("Feasibility: ").append(summary.getFeasibilityRating()).append('\n');
        }
        if (summary.getMarketSize() != null && !summary.getMarketSize().isBlank()) {
            sb.append("Market Size: ").append(summary.getMarketSize()).append('\n');
        }
        if (summary.hasGaps()) {
            sb.append("\nTOP GAPS:\n");
            List<GapSummary> gaps = summary.getTopGaps();
            for (int i = 0; i < Math.min(MAX_SUMMARY_GAPS, gaps.size()); i++) {
                GapSummary gap = gaps.get(i);
                sb.append(i + 1).append(". ").append(gap.getTitle());
                if (gap.getScore() != null) {
                    sb.append(" (Score: ").append(gap.getScore()).append(')');
                }
                sb.append('\n');
                if (gap.getDescription() != null && !gap.getDescription().isBlank()) {
                    sb.append("   ").append(tokenEstimator.truncate(gap.getDescription(), GAP_DESCRIPTION_TOKENS)).append('\n');
                }
            }
        }
        if (summary.getCompetitors() != null && !summary.getCompetitors().isEmpty()) {
            sb.append("\nKEY COMPETITORS:\n");
            summary.getCompetitors().stream()
                    .limit(MAX_SUMMARY_COMPETITORS)
                    .forEach(c -> sb.append("- ").append(c).append('\n'));
        }
        return sb.toString().trim();
    }

    private static List<Message> eligibleTurns(List<Message> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<Message> eligible = new ArrayList<>(history.size());
        for (Message m : history) {
            if (m == null || m.getContent() == null || m.getContent().isBlank()) {
                continue;
            }
            if (!(m.isUser() || m.isAssistant()) || !m.isCompleted()) {
                continue;
            }
            eligible.add(m);
        }
        return eligible;
    }
}
