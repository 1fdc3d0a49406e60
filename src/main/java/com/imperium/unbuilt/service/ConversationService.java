package com.imperium.unbuilt.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.unbuilt.model.entity.Conversation;

/**
 * 会话读写。每个 (analysisId, userId) 至多一个会话。
 */
public interface ConversationService extends IService<Conversation> {

    /** 不存在时返回 null */
    Conversation findByAnalysisAndUser(String analysisId, String userId);
}
