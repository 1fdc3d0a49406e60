package com.imperium.unbuilt.controller;

import com.imperium.unbuilt.config.CallerHeaders;
import com.imperium.unbuilt.model.dto.request.ClearConversationRequest;
import com.imperium.unbuilt.model.dto.response.ConversationDetailResponse;
import com.imperium.unbuilt.model.dto.response.MessageHistoryResponse;
import com.imperium.unbuilt.policy.SubscriptionTier;
import com.imperium.unbuilt.service.ConversationLifecycleService;
import com.imperium.unbuilt.service.DeduplicationStats;
import com.imperium.unbuilt.service.QueryDeduplicationCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 会话接口：打开、历史、清空。
 */
@RestController
@RequestMapping("/api/conversations")
@Tag(name = "Conversations", description = "会话管理接口")
public class ConversationController {

    private final ConversationLifecycleService lifecycleService;
    private final QueryDeduplicationCache dedupCache;

    public ConversationController(ConversationLifecycleService lifecycleService, QueryDeduplicationCache dedupCache) {
        this.lifecycleService = lifecycleService;
        this.dedupCache = dedupCache;
    }

    @GetMapping("/{analysisId}")
    @Operation(summary = "打开会话", description = "获取或创建该分析下的会话，附带消息、推荐问题、统计与限额")
    public ConversationDetailResponse open(
            @Parameter(description = "分析 ID", required = true) @PathVariable String analysisId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.SUBSCRIPTION_TIER, required = false) String tier) {
        return lifecycleService.openConversation(analysisId, CallerHeaders.requireUserId(userId), SubscriptionTier.from(tier));
    }

    @GetMapping("/{conversationId}/history")
    @Operation(summary = "消息历史", description = "按时间正序分页，limit 默认 50，最大 100")
    public MessageHistoryResponse history(
            @PathVariable String conversationId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @Parameter(description = "分页大小") @RequestParam(required = false) Integer limit,
            @Parameter(description = "从最早消息起的偏移") @RequestParam(required = false) Integer offset) {
        return lifecycleService.getHistory(conversationId, CallerHeaders.requireUserId(userId), limit, offset);
    }

    @DeleteMapping("/{conversationId}")
    @Operation(summary = "清空会话", description = "删除消息和推荐问题并重置统计，需 confirm=true")
    public ResponseEntity<Map<String, Object>> clear(
            @PathVariable String conversationId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestBody(required = false) ClearConversationRequest body) {
        boolean confirm = body != null && body.isConfirm();
        lifecycleService.clearConversation(conversationId, CallerHeaders.requireUserId(userId), confirm);
        return ResponseEntity.ok(Map.of("conversationId", conversationId, "cleared", true));
    }

    @GetMapping("/stats/deduplication")
    @Operation(summary = "去重统计", description = "去重缓存命中率与估算节省")
    public DeduplicationStats deduplicationStats() {
        return dedupCache.stats();
    }
}
