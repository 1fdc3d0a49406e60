package com.imperium.unbuilt.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageHistoryResponse {

    private String conversationId;

    private List<MessageDto> messages;

    private long total;

    private int limit;

    private int offset;

    private boolean hasMore;
}
