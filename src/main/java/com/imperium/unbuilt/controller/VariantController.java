package com.imperium.unbuilt.controller;

import com.imperium.unbuilt.config.CallerHeaders;
import com.imperium.unbuilt.model.dto.request.CreateVariantRequest;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse;
import com.imperium.unbuilt.model.entity.ConversationVariant;
import com.imperium.unbuilt.service.VariantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/conversations")
@Tag(name = "Variants", description = "分析变体接口")
public class VariantController {

    private final VariantService variantService;

    public VariantController(VariantService variantService) {
        this.variantService = variantService;
    }

    @PostMapping("/{conversationId}/variants")
    @Operation(summary = "创建变体", description = "以修改后的查询派生一次分析，并挂到当前会话下")
    public ResponseEntity<ConversationVariant> create(
            @PathVariable String conversationId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @Valid @RequestBody CreateVariantRequest body) {
        ConversationVariant variant = variantService.createVariant(conversationId, CallerHeaders.requireUserId(userId),
                body.getModifiedQuery(), body.getParameters());
        return ResponseEntity.status(HttpStatus.CREATED).body(variant);
    }

    @GetMapping("/{conversationId}/variants")
    @Operation(summary = "变体列表")
    public List<ConversationVariant> list(@PathVariable String conversationId,
                                          @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId) {
        return variantService.listVariants(conversationId, CallerHeaders.requireUserId(userId));
    }

    @GetMapping("/{conversationId}/variants/{variantId}/compare")
    @Operation(summary = "对比变体", description = "创新分差、可行性变化、缺口增删与参数变化")
    public VariantComparisonResponse compare(
            @PathVariable String conversationId,
            @Parameter(description = "变体 ID 或变体分析 ID") @PathVariable String variantId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId) {
        return variantService.compareVariants(conversationId, variantId, CallerHeaders.requireUserId(userId));
    }
}
