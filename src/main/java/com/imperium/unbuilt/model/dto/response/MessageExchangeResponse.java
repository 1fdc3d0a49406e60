package com.imperium.unbuilt.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imperium.unbuilt.policy.RateLimitDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 发送消息的同步响应：一问一答 + 限额视图。cached / similarity 仅在命中去重缓存时出现。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageExchangeResponse {

    private MessageDto userMessage;

    private MessageDto aiMessage;

    private RateLimitDecision rateLimit;

    private Boolean cached;

    private Double similarity;
}
