package com.imperium.unbuilt.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话表实体，对应 conversations 表。每个 (analysisId, userId) 至多一个会话。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("conversations")
public class Conversation {

    /** 会话ID */
    @TableId
    private String id;

    /** 所属分析ID（searches.id） */
    @TableField("analysis_id")
    private String analysisId;

    /** 所属用户 */
    @TableField("user_id")
    private String userId;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 更新时间 */
    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
