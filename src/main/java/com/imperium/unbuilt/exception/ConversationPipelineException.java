package com.imperium.unbuilt.exception;

import java.util.Map;

/**
 * 对话流水线异常基类。每个阶段的失败都以子类形式抛出，由 GlobalExceptionHandler 或 SSE error 事件统一渲染。
 */
public class ConversationPipelineException extends RuntimeException {

    private final ErrorCode errorCode;

    public ConversationPipelineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ConversationPipelineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /** 附加到 error.details 的字段；默认无。 */
    public Map<String, Object> details() {
        return Map.of();
    }
}
