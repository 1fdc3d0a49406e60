package com.imperium.unbuilt.controller;

import com.imperium.unbuilt.ai.orchestrator.ConversationMessageOrchestrator;
import com.imperium.unbuilt.ai.orchestrator.MessageCommand;
import com.imperium.unbuilt.config.CallerHeaders;
import com.imperium.unbuilt.model.dto.request.SendMessageRequest;
import com.imperium.unbuilt.model.dto.response.MessageExchangeResponse;
import com.imperium.unbuilt.policy.SubscriptionTier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * 发送消息：同一路径，stream=true 时走 SSE。
 */
@RestController
@RequestMapping("/api/conversations")
@Tag(name = "Messages", description = "消息发送接口")
public class MessageController {

    private final ConversationMessageOrchestrator orchestrator;

    public MessageController(ConversationMessageOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/{analysisId}/messages")
    @Operation(summary = "发送消息", description = "限流、校验、注入检测、审核后生成回复，返回一问一答")
    public MessageExchangeResponse send(
            @Parameter(description = "分析 ID", required = true) @PathVariable String analysisId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.SUBSCRIPTION_TIER, required = false) String tier,
            @Valid @RequestBody SendMessageRequest body,
            HttpServletRequest request) {
        return orchestrator.send(command(analysisId, userId, tier, body, false, request));
    }

    /**
     * SSE 事件：chunk（若干）→ complete | error。免费档位按批量生成后一次性下发。
     */
    @PostMapping(value = "/{analysisId}/messages", params = "stream=true", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "发送消息（流式）", description = "SSE 返回 chunk / complete / error 事件")
    public Flux<ServerSentEvent<String>> stream(
            @Parameter(description = "分析 ID", required = true) @PathVariable String analysisId,
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.SUBSCRIPTION_TIER, required = false) String tier,
            @Valid @RequestBody SendMessageRequest body,
            HttpServletRequest request) {
        return orchestrator.stream(command(analysisId, userId, tier, body, true, request));
    }

    private static MessageCommand command(String analysisId, String userId, String tier, SendMessageRequest body,
                                          boolean stream, HttpServletRequest request) {
        return new MessageCommand(analysisId, CallerHeaders.requireUserId(userId), SubscriptionTier.from(tier),
                body.getContent(), stream, request.getRemoteAddr(), request.getHeader("User-Agent"));
    }
}
