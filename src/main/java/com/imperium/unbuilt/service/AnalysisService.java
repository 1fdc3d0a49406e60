package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.entity.Analysis;

/**
 * 读取缺口分析（searches / search_results）。
 */
public interface AnalysisService {

    /**
     * 分析不存在时抛 AnalysisNotFoundException，不属于该用户时抛 UnauthorizedAccessException。
     */
    Analysis requireOwnedAnalysis(String analysisId, String userId);

    Analysis getAnalysis(String analysisId);

    /** 按创新分降序取前 gapLimit 个缺口组装摘要 */
    AnalysisSummary loadSummary(Analysis analysis, int gapLimit);

    /** 为变体登记一条新的分析记录，结果由分析模块异步填充 */
    Analysis createVariantAnalysis(Analysis parent, String userId, String modifiedQuery);
}
