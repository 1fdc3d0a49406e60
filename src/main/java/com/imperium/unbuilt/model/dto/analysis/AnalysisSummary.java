package com.imperium.unbuilt.model.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次缺口分析的精简视图，供上下文、推荐问题和变体对比使用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisSummary {

    private String analysisId;

    /** 用户原始搜索 */
    private String searchQuery;

    /** 缺口创新分的均值 */
    private Integer innovationScore;

    /** 整体可行性：high | medium | low */
    private String feasibilityRating;

    /** 按创新分降序 */
    private List<GapSummary> topGaps;

    private List<String> competitors;

    private String marketSize;

    public boolean hasGaps() {
        return topGaps != null && !topGaps.isEmpty();
    }
}
