package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 请求用量表实体，对应 request_usage 表（成本与耗时统计）。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("request_usage")
public class RequestUsage {

    @TableId
    private String id;

    /** 关联的 assistant 消息ID */
    @TableField("message_id")
    private String messageId;

    @TableField("conversation_id")
    private String conversationId;

    @TableField("user_id")
    private String userId;

    /** 调用的模型名；命中缓存时为空 */
    private String model;

    @TableField("latency_ms")
    private Integer latencyMs;

    @TableField("prompt_tokens")
    private Integer promptTokens;

    @TableField("completion_tokens")
    private Integer completionTokens;

    @TableField("estimated_cost_usd")
    private Double estimatedCostUsd;

    private Boolean cached;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
