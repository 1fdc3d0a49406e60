package com.imperium.unbuilt.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

@Data
public class CreateVariantRequest {

    @NotBlank(message = "modifiedQuery is required")
    @Size(max = 500, message = "modifiedQuery must be at most 500 characters")
    private String modifiedQuery;

    /** 变更的参数，如 targetAudience、region（可选） */
    private Map<String, String> parameters;
}
