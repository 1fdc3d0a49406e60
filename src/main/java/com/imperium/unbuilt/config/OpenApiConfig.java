package com.imperium.unbuilt.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI unbuiltConversationOpenApi(@Value("${server.port:8093}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Unbuilt Conversation API")
                        .description("缺口分析 AI 顾问对话接口：消息流水线、推荐问题、分析变体与反馈")
                        .version("v1")
                        .contact(new Contact().name("Unbuilt Team")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
