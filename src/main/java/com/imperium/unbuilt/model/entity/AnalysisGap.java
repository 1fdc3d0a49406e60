package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分析结果中的单个市场缺口，对应 search_results 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("search_results")
public class AnalysisGap {

    @TableId
    private String id;

    @TableField("search_id")
    private String searchId;

    private String title;

    private String description;

    private String category;

    /** 创新分 0~100 */
    @TableField("innovation_score")
    private Integer innovationScore;

    /** high | medium | low */
    private String feasibility;

    @TableField("market_potential")
    private String marketPotential;

    @TableField("market_size")
    private String marketSize;

    @TableField("competitor_analysis")
    private String competitorAnalysis;
}
