package com.imperium.unbuilt.exception;

public class UnauthorizedAccessException extends ConversationPipelineException {

    public UnauthorizedAccessException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
