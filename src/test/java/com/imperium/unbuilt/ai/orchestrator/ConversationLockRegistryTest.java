package com.imperium.unbuilt.ai.orchestrator;

import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.exception.ConversationBusyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationLockRegistryTest {

    private ConversationLockRegistry registry;

    @BeforeEach
    void setUp() {
        ConversationProperties properties = new ConversationProperties();
        properties.setLockWait(Duration.ofMillis(100));
        registry = new ConversationLockRegistry(properties);
    }

    @Test
    void secondHolderTimesOutWhileLocked() {
        try (ConversationLockRegistry.Lease lease = registry.acquire("c1")) {
            assertThat(lease.conversationId()).isEqualTo("c1");
            assertThatThrownBy(() -> CompletableFuture.runAsync(() -> registry.acquire("c1")).join())
                    .hasCauseInstanceOf(ConversationBusyException.class);
        }
        registry.acquire("c1").close();
    }

    @Test
    void differentConversationsDoNotBlockEachOther() {
        try (ConversationLockRegistry.Lease ignored = registry.acquire("c1")) {
            registry.acquire("c2").close();
        }
    }

    @Test
    void leaseCanBeReleasedFromAnotherThreadAndOnlyOnce() throws Exception {
        ConversationLockRegistry.Lease lease = registry.acquire("c1");
        CompletableFuture.runAsync(lease::close).get(1, TimeUnit.SECONDS);
        lease.close();

        ConversationLockRegistry.Lease next = registry.acquire("c1");
        assertThatThrownBy(() -> registry.acquire("c1")).isInstanceOf(ConversationBusyException.class);
        next.close();
    }
}
