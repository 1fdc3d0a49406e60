package com.imperium.unbuilt.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imperium.unbuilt.model.entity.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对外的消息视图。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {

    private String id;

    private String conversationId;

    private Long sequence;

    /** user | assistant */
    private String role;

    private String content;

    /** done | cancelled | error */
    private String status;

    private Integer tokensIn;

    private Integer tokensOut;

    private Long processingTimeMs;

    private Boolean cached;

    private Integer rating;

    private LocalDateTime createdAt;

    public static MessageDto from(Message m) {
        return MessageDto.builder()
                .id(m.getId())
                .conversationId(m.getConversationId())
                .sequence(m.getSequence())
                .role(m.getRole())
                .content(m.getContent())
                .status(m.getStatus())
                .tokensIn(m.getPromptTokens())
                .tokensOut(m.getCompletionTokens())
                .processingTimeMs(m.getProcessingTimeMs())
                .cached(Boolean.TRUE.equals(m.getCached()) ? Boolean.TRUE : null)
                .rating(m.getRating())
                .createdAt(m.getCreatedAt())
                .build();
    }
}
