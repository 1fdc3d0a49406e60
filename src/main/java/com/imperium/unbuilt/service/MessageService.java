package com.imperium.unbuilt.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.unbuilt.model.entity.Message;

/**
 * 会话消息日志的读写，消息在会话内按 sequence 全序。
 */
public interface MessageService extends IService<Message> {

    /** 会话内已用的最大 sequence，没有消息时为 0 */
    default long maxSequence(String conversationId) {
        Message last = lambdaQuery()
                .select(Message::getSequence)
                .eq(Message::getConversationId, conversationId)
                .orderByDesc(Message::getSequence)
                .last("LIMIT 1")
                .one();
        return last != null && last.getSequence() != null ? last.getSequence() : 0L;
    }
}
