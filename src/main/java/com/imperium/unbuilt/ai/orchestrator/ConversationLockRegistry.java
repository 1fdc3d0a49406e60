package com.imperium.unbuilt.ai.orchestrator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.exception.ConversationBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按会话串行化的锁表。
 * <p>
 * 用单许可公平信号量而不是 ReentrantLock：流式请求在一个线程上加锁，
 * 可能在另一个线程上（完成、出错或客户端断开时）释放。
 * 信号量以弱引用缓存，只要还有持有者或等待者就不会被回收。
 */
@Component
public class ConversationLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConversationLockRegistry.class);

    private final Cache<String, Semaphore> locks = Caffeine.newBuilder().weakValues().build();
    private final Duration maxWait;

    public ConversationLockRegistry(ConversationProperties properties) {
        this.maxWait = properties.getLockWait();
    }

    /**
     * 获取会话锁，最多等待 lockWait。超时抛 {@link ConversationBusyException}。
     */
    public Lease acquire(String conversationId) {
        Semaphore semaphore = locks.get(conversationId, k -> new Semaphore(1, true));
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversationBusyException(conversationId);
        }
        if (!acquired) {
            log.warn("Conversation lock wait timed out: conversationId={}, waitMs={}", conversationId, maxWait.toMillis());
            throw new ConversationBusyException(conversationId);
        }
        return new Lease(conversationId, semaphore);
    }

    /**
     * 已持有的会话锁。close 幂等，可在任意线程调用。
     */
    public static final class Lease implements AutoCloseable {

        private final String conversationId;
        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease(String conversationId, Semaphore semaphore) {
            this.conversationId = conversationId;
            this.semaphore = semaphore;
        }

        public String conversationId() {
            return conversationId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
