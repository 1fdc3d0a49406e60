package com.imperium.unbuilt.exception;

import com.imperium.unbuilt.ai.generation.GenerationMetadata;

import java.util.HashMap;
import java.util.Map;

/**
 * 生成已完成但写库失败。携带生成内容与元数据，调用方可据此重试保存，避免重复付费生成。
 */
public class PersistenceFailedException extends ConversationPipelineException {

    private final String conversationId;
    private final String generatedContent;
    private final GenerationMetadata metadata;

    public PersistenceFailedException(String conversationId, String generatedContent,
                                      GenerationMetadata metadata, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, "Failed to save the conversation. The generated reply is included so it can be saved again.", cause);
        this.conversationId = conversationId;
        this.generatedContent = generatedContent;
        this.metadata = metadata;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getGeneratedContent() {
        return generatedContent;
    }

    public GenerationMetadata getMetadata() {
        return metadata;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> details = new HashMap<>();
        details.put("conversationId", conversationId);
        details.put("content", generatedContent != null ? generatedContent : "");
        if (metadata != null) {
            details.put("metadata", metadata);
        }
        return details;
    }
}
