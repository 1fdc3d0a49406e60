package com.imperium.unbuilt.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.unbuilt.mapper.ConversationMapper;
import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.service.ConversationService;
import org.springframework.stereotype.Service;

@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation> implements ConversationService {

    @Override
    public Conversation findByAnalysisAndUser(String analysisId, String userId) {
        // 唯一索引 uk_conversations_analysis_user 保证至多一条
        return lambdaQuery()
                .eq(Conversation::getAnalysisId, analysisId)
                .eq(Conversation::getUserId, userId)
                .last("LIMIT 1")
                .one();
    }
}
