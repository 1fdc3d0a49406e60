package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 推荐问题表实体，对应 suggested_questions 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("suggested_questions")
public class SuggestedQuestion {

    @TableId
    private String id;

    @TableField("conversation_id")
    private String conversationId;

    @TableField("question_text")
    private String questionText;

    /** market_validation | competitive_analysis | execution_strategy | risk_assessment */
    private String category;

    /** 0~100，越大越靠前 */
    private Integer priority;

    private Boolean used;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
