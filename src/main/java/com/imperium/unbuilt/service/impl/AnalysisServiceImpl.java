package com.imperium.unbuilt.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.imperium.unbuilt.config.IdSupport;
import com.imperium.unbuilt.exception.AnalysisNotFoundException;
import com.imperium.unbuilt.exception.UnauthorizedAccessException;
import com.imperium.unbuilt.mapper.AnalysisGapMapper;
import com.imperium.unbuilt.mapper.AnalysisMapper;
import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.AnalysisGap;
import com.imperium.unbuilt.service.AnalysisService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

@Service
public class AnalysisServiceImpl implements AnalysisService {

    private final AnalysisMapper analysisMapper;
    private final AnalysisGapMapper analysisGapMapper;

    public AnalysisServiceImpl(AnalysisMapper analysisMapper, AnalysisGapMapper analysisGapMapper) {
        this.analysisMapper = analysisMapper;
        this.analysisGapMapper = analysisGapMapper;
    }

    @Override
    public Analysis requireOwnedAnalysis(String analysisId, String userId) {
        Analysis analysis = analysisMapper.selectById(analysisId);
        if (analysis == null) {
            throw new AnalysisNotFoundException("Analysis not found");
        }
        if (!Objects.equals(analysis.getUserId(), userId)) {
            throw new UnauthorizedAccessException("You do not have access to this analysis");
        }
        return analysis;
    }

    @Override
    public Analysis getAnalysis(String analysisId) {
        return analysisMapper.selectById(analysisId);
    }

    @Override
    public AnalysisSummary loadSummary(Analysis analysis, int gapLimit) {
        List<AnalysisGap> gaps = analysisGapMapper.selectList(new LambdaQueryWrapper<AnalysisGap>()
                .eq(AnalysisGap::getSearchId, analysis.getId())
                .orderByDesc(AnalysisGap::getInnovationScore)
                .last("LIMIT " + Math.max(1, gapLimit)));

        List<GapSummary> topGaps = gaps.stream()
                .map(g -> GapSummary.builder()
                        .title(g.getTitle())
                        .description(g.getDescription())
                        .category(g.getCategory())
                        .score(g.getInnovationScore())
                        .feasibility(g.getFeasibility())
                        .marketPotential(g.getMarketPotential())
                        .build())
                .toList();

        Integer innovationScore = gaps.isEmpty() ? null : (int) Math.round(gaps.stream()
                .map(AnalysisGap::getInnovationScore)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0));

        AnalysisGap top = gaps.isEmpty() ? null : gaps.get(0);
        return AnalysisSummary.builder()
                .analysisId(analysis.getId())
                .searchQuery(analysis.getQuery())
                .innovationScore(innovationScore)
                .feasibilityRating(overallFeasibility(gaps))
                .topGaps(topGaps)
                .competitors(top != null ? splitCompetitors(top.getCompetitorAnalysis()) : List.of())
                .marketSize(top != null ? top.getMarketSize() : null)
                .build();
    }

    @Override
    public Analysis createVariantAnalysis(Analysis parent, String userId, String modifiedQuery) {
        Analysis variant = new Analysis(IdSupport.newId("a_"), userId, modifiedQuery, 0, parent.getId(), LocalDateTime.now());
        analysisMapper.insert(variant);
        return variant;
    }

    /** 多数缺口的可行性作为整体可行性；无数据时为 null */
    private static String overallFeasibility(List<AnalysisGap> gaps) {
        long high = gaps.stream().filter(g -> "high".equalsIgnoreCase(g.getFeasibility())).count();
        long low = gaps.stream().filter(g -> "low".equalsIgnoreCase(g.getFeasibility())).count();
        long medium = gaps.stream().filter(g -> "medium".equalsIgnoreCase(g.getFeasibility())).count();
        if (high + low + medium == 0) {
            return null;
        }
        if (high >= medium && high >= low) {
            return "high";
        }
        return medium >= low ? "medium" : "low";
    }

    private static List<String> splitCompetitors(String competitorAnalysis) {
        if (competitorAnalysis == null || competitorAnalysis.isBlank()) {
            return List.of();
        }
        return Arrays.stream(competitorAnalysis.split("[,;\\n]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty() && s.length() <= 120)
                .map(s -> s.toLowerCase(Locale.ROOT).startsWith("competitors:") ? s.substring(12).trim() : s)
                .filter(s -> !s.isEmpty())
                .limit(5)
                .toList();
    }
}
