package com.imperium.unbuilt.exception;

public class ContentRejectedException extends ConversationPipelineException {

    public ContentRejectedException(String message) {
        super(ErrorCode.CONTENT_REJECTED, message);
    }
}
