package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息表实体，对应 messages 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("messages")
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static final String STATUS_DONE = "done";
    public static final String STATUS_CANCELLED = "cancelled";
    public static final String STATUS_ERROR = "error";

    /** 消息ID */
    @TableId
    private String id;

    /** 所属会话ID */
    @TableField("conversation_id")
    private String conversationId;

    /** 会话内序号，严格递增，决定消息全序 */
    private Long sequence;

    /** 角色：user | assistant */
    private String role;

    /** 消息内容 */
    private String content;

    /** 状态：done | cancelled | error */
    private String status;

    /** 请求 token 数 */
    @TableField("prompt_tokens")
    private Integer promptTokens;

    /** 回复 token 数 */
    @TableField("completion_tokens")
    private Integer completionTokens;

    /** 生成耗时（毫秒） */
    @TableField("processing_time_ms")
    private Long processingTimeMs;

    /** 是否命中去重缓存 */
    private Boolean cached;

    /** 命中缓存时的相似度 */
    private Double similarity;

    /** 用户评分 1~5 */
    private Integer rating;

    /** 评分反馈 */
    @TableField("rating_feedback")
    private String ratingFeedback;

    /** 是否被举报 */
    private Boolean flagged;

    /** 错误码（status=error 时） */
    @TableField("error_code")
    private String errorCode;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }

    /** 完整结束的消息；status 为空的历史数据视为完成 */
    public boolean isCompleted() {
        return status == null || STATUS_DONE.equals(status);
    }
}
