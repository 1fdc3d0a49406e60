package com.imperium.unbuilt.controller;

import com.imperium.unbuilt.config.CallerHeaders;
import com.imperium.unbuilt.guard.GuardContext;
import com.imperium.unbuilt.guard.MessageReportCommand;
import com.imperium.unbuilt.model.dto.request.RateMessageRequest;
import com.imperium.unbuilt.model.dto.request.ReportMessageRequest;
import com.imperium.unbuilt.model.dto.response.MessageDto;
import com.imperium.unbuilt.model.dto.response.ReportResponse;
import com.imperium.unbuilt.service.MessageFeedbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 消息评分与举报。
 */
@RestController
@RequestMapping("/api/conversations/messages")
@Tag(name = "Message feedback", description = "消息评分与举报接口")
public class MessageFeedbackController {

    private final MessageFeedbackService feedbackService;

    public MessageFeedbackController(MessageFeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping("/{messageId}/rate")
    @Operation(summary = "评分", description = "1~5 分，可附 500 字以内反馈")
    public MessageDto rate(@PathVariable String messageId,
                           @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
                           @Valid @RequestBody RateMessageRequest body) {
        return feedbackService.rateMessage(messageId, CallerHeaders.requireUserId(userId), body.getRating(), body.getFeedback());
    }

    @PostMapping("/{messageId}/report")
    @Operation(summary = "举报", description = "类别：inappropriate | inaccurate | harmful | spam | other")
    public ResponseEntity<ReportResponse> report(@PathVariable String messageId,
                                                 @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
                                                 @Valid @RequestBody ReportMessageRequest body,
                                                 HttpServletRequest request) {
        String caller = CallerHeaders.requireUserId(userId);
        MessageReportCommand command = new MessageReportCommand(messageId, caller, body.getCategory(),
                body.getReason(), body.getDetails());
        GuardContext ctx = new GuardContext(caller, null, request.getRemoteAddr(), request.getHeader("User-Agent"));
        return ResponseEntity.status(HttpStatus.CREATED).body(feedbackService.reportMessage(command, ctx));
    }
}
