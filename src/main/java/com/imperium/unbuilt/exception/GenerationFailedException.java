package com.imperium.unbuilt.exception;

import java.util.Map;

/**
 * 生成后端失败（网络、提供商错误或超时）。
 */
public class GenerationFailedException extends ConversationPipelineException {

    public enum Kind {
        BACKEND, TIMEOUT
    }

    private final Kind kind;

    public GenerationFailedException(Kind kind, String message, Throwable cause) {
        super(ErrorCode.GENERATION_FAILED, message, cause);
        this.kind = kind;
    }

    public static GenerationFailedException backend(Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown error";
        return new GenerationFailedException(Kind.BACKEND, "Generation backend failed: " + detail, cause);
    }

    public static GenerationFailedException timeout(String message) {
        return new GenerationFailedException(Kind.TIMEOUT, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("kind", kind.name().toLowerCase());
    }
}
