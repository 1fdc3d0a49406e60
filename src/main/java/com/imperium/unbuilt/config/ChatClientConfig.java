package com.imperium.unbuilt.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提供 {@link ChatClient} bean。
 * spring-ai-starter-model-openai 自动配置 ChatModel 和 ChatClient.Builder；
 * 这里把 app.generation 的输出上限和温度设为默认选项，推荐问题生成等未显式传 options 的调用同样受限。
 * 顾问回答按请求拼装系统提示词，不设置默认 system。
 */
@Configuration
public class ChatClientConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder,
                                 @Value("${app.generation.max-output-tokens:2048}") int maxOutputTokens,
                                 @Value("${app.generation.temperature:0.7}") double temperature) {
        return builder
                .defaultOptions(OpenAiChatOptions.builder()
                        .maxTokens(maxOutputTokens)
                        .temperature(temperature)
                        .build())
                .build();
    }
}
