package com.imperium.unbuilt.exception;

public class ValidationFailedException extends ConversationPipelineException {

    public ValidationFailedException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
