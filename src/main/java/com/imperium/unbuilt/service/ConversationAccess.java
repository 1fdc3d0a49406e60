package com.imperium.unbuilt.service;

import com.imperium.unbuilt.exception.ResourceNotFoundException;
import com.imperium.unbuilt.exception.UnauthorizedAccessException;
import com.imperium.unbuilt.model.entity.Conversation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 会话归属校验，按会话 ID 访问的接口共用。
 */
@Component
public class ConversationAccess {

    private static final Logger securityLog = LoggerFactory.getLogger("security");

    private final ConversationStore store;

    public ConversationAccess(ConversationStore store) {
        this.store = store;
    }

    public Conversation requireOwned(String conversationId, String userId) {
        Conversation conversation = store.getConversation(conversationId);
        if (conversation == null) {
            throw new ResourceNotFoundException("Conversation not found");
        }
        if (!conversation.getUserId().equals(userId)) {
            securityLog.warn("Unauthorized conversation access: conversationId={}, userId={}", conversationId, userId);
            throw new UnauthorizedAccessException("You do not have access to this conversation");
        }
        return conversation;
    }
}
