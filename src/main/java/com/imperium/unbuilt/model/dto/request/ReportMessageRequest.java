package com.imperium.unbuilt.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 举报 assistant 消息。
 */
@Data
public class ReportMessageRequest {

    @NotBlank(message = "category is required")
    @Pattern(regexp = "^(inappropriate|inaccurate|harmful|spam|other)$",
            message = "category must be one of: inappropriate, inaccurate, harmful, spam, other")
    private String category;

    @NotBlank(message = "reason is required")
    @Size(max = 500, message = "reason must be at most 500 characters")
    private String reason;

    @Size(max = 1000, message = "details must be at most 1000 characters")
    private String details;
}
