package com.imperium.unbuilt.exception;

public class AnalysisNotFoundException extends ConversationPipelineException {

    public AnalysisNotFoundException(String message) {
        super(ErrorCode.ANALYSIS_NOT_FOUND, message);
    }
}
