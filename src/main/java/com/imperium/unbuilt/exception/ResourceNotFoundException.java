package com.imperium.unbuilt.exception;

public class ResourceNotFoundException extends ConversationPipelineException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
