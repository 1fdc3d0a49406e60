package com.imperium.unbuilt.exception;

import org.springframework.http.HttpStatus;

/**
 * 对话流水线错误分类。code 为对外暴露的错误码，clientCaused 区分“用户输入被拒”与“服务端失败”。
 */
public enum ErrorCode {

    QUOTA_EXCEEDED("quota_exceeded", HttpStatus.TOO_MANY_REQUESTS, true),
    VALIDATION_FAILED("validation_failed", HttpStatus.BAD_REQUEST, true),
    INJECTION_DETECTED("injection_detected", HttpStatus.BAD_REQUEST, true),
    CONTENT_REJECTED("content_rejected", HttpStatus.BAD_REQUEST, true),
    ANALYSIS_NOT_FOUND("analysis_not_found", HttpStatus.NOT_FOUND, true),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND, true),
    UNAUTHORIZED("forbidden", HttpStatus.FORBIDDEN, true),
    CONVERSATION_BUSY("conversation_busy", HttpStatus.CONFLICT, true),
    GENERATION_FAILED("generation_failed", HttpStatus.BAD_GATEWAY, false),
    PERSISTENCE_FAILED("persistence_failed", HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final String code;
    private final HttpStatus status;
    private final boolean clientCaused;

    ErrorCode(String code, HttpStatus status, boolean clientCaused) {
        this.code = code;
        this.status = status;
        this.clientCaused = clientCaused;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    public boolean isClientCaused() {
        return clientCaused;
    }
}
