package com.imperium.unbuilt.model.dto.request;

import lombok.Data;

@Data
public class ClearConversationRequest {

    /** 必须显式为 true */
    private boolean confirm;
}
