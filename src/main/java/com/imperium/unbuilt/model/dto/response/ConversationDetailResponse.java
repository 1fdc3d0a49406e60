package com.imperium.unbuilt.model.dto.response;

import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.model.entity.ConversationAnalytics;
import com.imperium.unbuilt.policy.RateLimitDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 打开会话时返回的完整视图。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationDetailResponse {

    private Conversation conversation;

    /** 最近的消息，时间正序 */
    private List<MessageDto> messages;

    private long totalMessages;

    private List<SuggestionDto> suggestions;

    private ConversationAnalytics analytics;

    private RateLimitDecision rateLimit;
}
