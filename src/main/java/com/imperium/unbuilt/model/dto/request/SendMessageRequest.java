package com.imperium.unbuilt.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 发送消息请求。长度上限按订阅档位在流水线里校验。
 */
@Data
public class SendMessageRequest {

    @NotBlank(message = "content is required")
    private String content;
}
