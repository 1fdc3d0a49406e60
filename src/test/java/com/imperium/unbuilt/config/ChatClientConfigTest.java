package com.imperium.unbuilt.config;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatClientConfigTest {

    @Test
    void generationLimitsBecomeDefaultOptions() {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        ChatClient client = mock(ChatClient.class);
        when(builder.defaultOptions(any(ChatOptions.class))).thenReturn(builder);
        when(builder.build()).thenReturn(client);

        ChatClient built = new ChatClientConfig().chatClient(builder, 1024, 0.3);

        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(builder).defaultOptions(options.capture());
        assertThat(built).isSameAs(client);
        assertThat(options.getValue().getMaxTokens()).isEqualTo(1024);
        assertThat(options.getValue().getTemperature()).isEqualTo(0.3);
    }
}
