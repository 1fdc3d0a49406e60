package com.imperium.unbuilt.controller;

import com.imperium.unbuilt.config.CallerHeaders;
import com.imperium.unbuilt.model.dto.response.SuggestionDto;
import com.imperium.unbuilt.service.SuggestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/conversations")
@Tag(name = "Suggestions", description = "推荐问题接口")
public class SuggestionController {

    private final SuggestionService suggestionService;

    public SuggestionController(SuggestionService suggestionService) {
        this.suggestionService = suggestionService;
    }

    @GetMapping("/{conversationId}/suggestions")
    @Operation(summary = "推荐问题", description = "当前未使用的推荐问题，按优先级降序")
    public List<SuggestionDto> list(@PathVariable String conversationId,
                                    @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId) {
        return suggestionService.getSuggestedQuestions(conversationId, CallerHeaders.requireUserId(userId));
    }

    @PostMapping("/{conversationId}/suggestions/refresh")
    @Operation(summary = "刷新推荐问题", description = "按对话进展重新生成并排序")
    public List<SuggestionDto> refresh(@PathVariable String conversationId,
                                       @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId) {
        return suggestionService.refreshSuggestedQuestions(conversationId, CallerHeaders.requireUserId(userId));
    }

    @PostMapping("/suggestions/{questionId}/used")
    @Operation(summary = "标记已使用")
    public ResponseEntity<Void> markUsed(@PathVariable String questionId,
                                         @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId) {
        suggestionService.markUsed(questionId, CallerHeaders.requireUserId(userId));
        return ResponseEntity.noContent().build();
    }
}
