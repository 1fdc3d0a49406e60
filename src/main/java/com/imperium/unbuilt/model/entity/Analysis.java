package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 缺口分析（一次搜索），对应 searches 表。由分析模块写入，本服务只读，变体除外。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("searches")
public class Analysis {

    @TableId
    private String id;

    @TableField("user_id")
    private String userId;

    private String query;

    @TableField("results_count")
    private Integer resultsCount;

    /** 派生自哪个分析（变体时非空） */
    @TableField("parent_analysis_id")
    private String parentAnalysisId;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
