package com.imperium.unbuilt.controller;

import com.imperium.unbuilt.config.RequestIdSupport;
import com.imperium.unbuilt.exception.ConversationPipelineException;
import com.imperium.unbuilt.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理：统一输出 {"error":{code,message,requestId,details?}}。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERATION_FAILED_MESSAGE = "The AI advisor is temporarily unavailable. Please try again in a moment.";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", message, field != null ? Map.of("field", field) : null);
    }

    @ExceptionHandler(ConversationPipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipeline(ConversationPipelineException ex) {
        ErrorCode code = ex.getErrorCode();
        String message = code == ErrorCode.GENERATION_FAILED ? GENERATION_FAILED_MESSAGE : ex.getMessage();
        if (code.isClientCaused()) {
            log.info("Request rejected: code={}, message={}", code.code(), ex.getMessage());
        } else {
            log.error("Request failed: code={}, message={}", code.code(), ex.getMessage(), ex);
        }
        Map<String, Object> details = ex.details().isEmpty() ? null : ex.details();
        return error(code.status(), code.code(), message, details);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Malformed request body", null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
                                                             Map<String, Object> details) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", resolveRequestId());
        if (details != null) {
            err.put("details", details);
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RequestIdSupport.resolve(null);
        }
        HttpServletRequest request = attributes.getRequest();
        return RequestIdSupport.resolve(request);
    }
}
