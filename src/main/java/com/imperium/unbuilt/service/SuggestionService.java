package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.response.SuggestionDto;

import java.util.List;

/**
 * 会话推荐问题：初始生成、刷新、标记已用。
 */
public interface SuggestionService {

    /** 新会话的初始问题，覆盖该会话现有的未使用问题 */
    List<SuggestionDto> initialSuggestions(String conversationId, AnalysisSummary summary);

    /** 当前未使用的问题，按优先级降序 */
    List<SuggestionDto> getSuggestedQuestions(String conversationId, String userId);

    /** 丢弃未使用的问题，按分析和对话历史重新生成并排序 */
    List<SuggestionDto> refreshSuggestedQuestions(String conversationId, String userId);

    void markUsed(String questionId, String userId);
}
