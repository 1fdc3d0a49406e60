package com.imperium.unbuilt.guard;

/**
 * 输入校验结果。valid=false 时 sanitizedText 为 null，reason 可直接展示给用户。
 */
public record InputValidationResult(boolean valid, String sanitizedText, String reason, Severity severity) {

    public static InputValidationResult ok(String sanitizedText) {
        return new InputValidationResult(true, sanitizedText, null, Severity.LOW);
    }

    public static InputValidationResult reject(String reason, Severity severity) {
        return new InputValidationResult(false, null, reason, severity);
    }
}
