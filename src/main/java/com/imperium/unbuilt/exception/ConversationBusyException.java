package com.imperium.unbuilt.exception;

/**
 * 同一会话上已有消息在处理，且在等待上限内未能拿到会话锁。
 */
public class ConversationBusyException extends ConversationPipelineException {

    public ConversationBusyException(String conversationId) {
        super(ErrorCode.CONVERSATION_BUSY,
                "Another message is still being processed in this conversation. Please try again shortly.");
    }
}
