package com.imperium.unbuilt.exception;

public class InjectionDetectedException extends ConversationPipelineException {

    public InjectionDetectedException(String message) {
        super(ErrorCode.INJECTION_DETECTED, message);
    }
}
