package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 会话变体表实体，对应 conversation_variants 表。
 * 变体 = 以修改后的查询参数派生出的新分析，及其独立会话。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName(value = "conversation_variants", autoResultMap = true)
public class ConversationVariant {

    @TableId
    private String id;

    /** 父会话ID */
    @TableField("conversation_id")
    private String conversationId;

    /** 派生出的分析ID */
    @TableField("variant_analysis_id")
    private String variantAnalysisId;

    /** 派生分析对应的会话ID */
    @TableField("variant_conversation_id")
    private String variantConversationId;

    @TableField("modified_query")
    private String modifiedQuery;

    /** 修改的参数，JSON 列 */
    @TableField(value = "parameters", typeHandler = JacksonTypeHandler.class)
    private Map<String, String> parameters;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
