package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话统计表实体，对应 conversation_analytics 表，每个会话一行。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("conversation_analytics")
public class ConversationAnalytics {

    @TableId(value = "conversation_id", type = IdType.INPUT)
    private String conversationId;

    @TableField("message_count")
    private Integer messageCount;

    @TableField("total_tokens_used")
    private Integer totalTokensUsed;

    /** assistant 回复的平均耗时（毫秒） */
    @TableField("avg_response_time_ms")
    private Long avgResponseTimeMs;

    @TableField("response_count")
    private Integer responseCount;

    /** 用户评分均值，无评分时为 null */
    @TableField("user_satisfaction")
    private Double userSatisfaction;

    @TableField("rating_count")
    private Integer ratingCount;

    @TableField("updated_at")
    private LocalDateTime updatedAt;

    public static ConversationAnalytics empty(String conversationId) {
        return new ConversationAnalytics(conversationId, 0, 0, 0L, 0, null, 0, LocalDateTime.now());
    }
}
