package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息举报表实体，对应 message_reports 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("message_reports")
public class MessageReport {

    @TableId
    private String id;

    @TableField("message_id")
    private String messageId;

    @TableField("conversation_id")
    private String conversationId;

    @TableField("reported_by")
    private String reportedBy;

    /** inappropriate | inaccurate | harmful | spam | other */
    private String category;

    private String reason;

    private String details;

    /** pending | reviewed | dismissed */
    private String status;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
