package com.imperium.unbuilt.policy;

import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.config.ConversationProperties.TierLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 按用户的三维限额：突发窗口、自然日、单会话问题数。
 * <p>
 * 每个用户的全部计数放在同一个状态对象里，通过 {@link ConcurrentHashMap#compute} 原子地检查并预占，
 * 因此同一用户的并发请求不会同时看到“还剩 1 条”而双双通过。
 * <p>
 * 计数只存在内存中，进程重启后清零；多实例部署时每个实例各自计数。
 */
@Component
public class ConversationRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConversationRateLimiter.class);

    private final ConversationProperties properties;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, UserQuota> quotas = new ConcurrentHashMap<>();

    public ConversationRateLimiter(ConversationProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getDailyResetZone());
    }

    /**
     * 检查并预占一条额度。允许时返回的 remaining 已扣除本条。
     */
    public RateLimitDecision checkAndReserve(String userId, String conversationId, SubscriptionTier tier) {
        TierLimits limits = properties.limitsFor(tier);
        if (limits.isUnlimited()) {
            return RateLimitDecision.unlimited(tier);
        }
        AtomicReference<RateLimitDecision> result = new AtomicReference<>();
        quotas.compute(userId, (k, existing) -> {
            UserQuota quota = existing != null ? existing : new UserQuota();
            Instant now = clock.instant();
            quota.roll(now, limits.getBurstWindow(), LocalDate.ofInstant(now, zone));

            RateLimitDecision rejection = firstExceeded(quota, conversationId, limits, tier, now);
            if (rejection != null) {
                result.set(rejection);
                return quota;
            }
            quota.reserve(conversationId, now);
            RateLimitDecision allowed = mostRestrictive(quota, conversationId, limits, tier, now);
            allowed.setReservedAt(now);
            result.set(allowed);
            return quota;
        });
        RateLimitDecision decision = result.get();
        if (!decision.isAllowed()) {
            log.info("Rate limit exceeded: userId={}, conversationId={}, tier={}, scope={}",
                    userId, conversationId, tier, decision.getExceeded());
        }
        return decision;
    }

    /**
     * 只读视图，不改变计数。
     */
    public RateLimitDecision peek(String userId, String conversationId, SubscriptionTier tier) {
        TierLimits limits = properties.limitsFor(tier);
        if (limits.isUnlimited()) {
            return RateLimitDecision.unlimited(tier);
        }
        AtomicReference<RateLimitDecision> result = new AtomicReference<>();
        quotas.compute(userId, (k, existing) -> {
            UserQuota quota = existing != null ? existing : new UserQuota();
            Instant now = clock.instant();
            quota.roll(now, limits.getBurstWindow(), LocalDate.ofInstant(now, zone));
            RateLimitDecision rejection = firstExceeded(quota, conversationId, limits, tier, now);
            result.set(rejection != null ? rejection : mostRestrictive(quota, conversationId, limits, tier, now));
            return quota;
        });
        return result.get();
    }

    /**
     * 退还一次预占（后续校验拒绝，或生成失败且未落库）。
     * <p>
     * 只撤销这次预占本身：已滑出突发窗口的不再动窗口，跨天的不再动当日计数。
     */
    public void release(String userId, String conversationId, RateLimitDecision reservation) {
        if (reservation == null || reservation.getReservedAt() == null) {
            return;
        }
        Instant reservedAt = reservation.getReservedAt();
        quotas.computeIfPresent(userId, (k, quota) -> {
            quota.release(conversationId, reservedAt, LocalDate.ofInstant(reservedAt, zone));
            return quota;
        });
        log.debug("Rate limit reservation released: userId={}, conversationId={}", userId, conversationId);
    }

    /**
     * 会话被清空后，该会话的问题数重新计算。
     */
    public void resetConversation(String userId, String conversationId) {
        quotas.computeIfPresent(userId, (k, quota) -> {
            quota.perConversation.remove(conversationId);
            return quota;
        });
    }

    // ==================== 私有：判定 ====================

    private RateLimitDecision firstExceeded(UserQuota quota, String conversationId, TierLimits limits,
                                            SubscriptionTier tier, Instant now) {
        if (limits.getBurstLimit() >= 0 && quota.burst.size() >= limits.getBurstLimit()) {
            return rejected(QuotaScope.BURST, limits.getBurstLimit(), burstResetAt(quota, limits, now), tier);
        }
        if (limits.getDailyLimit() >= 0 && quota.dailyCount >= limits.getDailyLimit()) {
            return rejected(QuotaScope.DAILY, limits.getDailyLimit(), nextMidnight(now), tier);
        }
        if (limits.getPerConversationLimit() >= 0
                && quota.conversationCount(conversationId) >= limits.getPerConversationLimit()) {
            return rejected(QuotaScope.CONVERSATION, limits.getPerConversationLimit(), null, tier);
        }
        return null;
    }

    private RateLimitDecision mostRestrictive(UserQuota quota, String conversationId, TierLimits limits,
                                              SubscriptionTier tier, Instant now) {
        RateLimitDecision best = null;
        if (limits.getBurstLimit() >= 0) {
            best = tighter(best, allowed(limits.getBurstLimit() - quota.burst.size(), limits.getBurstLimit(),
                    burstResetAt(quota, limits, now), tier));
        }
        if (limits.getDailyLimit() >= 0) {
            best = tighter(best, allowed(limits.getDailyLimit() - quota.dailyCount, limits.getDailyLimit(),
                    nextMidnight(now), tier));
        }
        if (limits.getPerConversationLimit() >= 0) {
            int limit = limits.getPerConversationLimit();
            best = tighter(best, allowed(limit - quota.conversationCount(conversationId), limit, null, tier));
        }
        return best != null ? best : RateLimitDecision.unlimited(tier);
    }

    private static RateLimitDecision tighter(RateLimitDecision current, RateLimitDecision candidate) {
        if (current == null || candidate.getRemaining() < current.getRemaining()) {
            return candidate;
        }
        return current;
    }

    private static RateLimitDecision allowed(int remaining, int limit, Instant resetAt, SubscriptionTier tier) {
        return RateLimitDecision.builder()
                .allowed(true)
                .remaining(Math.max(0, remaining))
                .limit(limit)
                .resetAt(resetAt)
                .tier(tier)
                .build();
    }

    private static RateLimitDecision rejected(QuotaScope scope, int limit, Instant resetAt, SubscriptionTier tier) {
        return RateLimitDecision.builder()
                .allowed(false)
                .remaining(0)
                .limit(limit)
                .resetAt(resetAt)
                .tier(tier)
                .exceeded(scope)
                .build();
    }

    private static Instant burstResetAt(UserQuota quota, TierLimits limits, Instant now) {
        Instant oldest = quota.burst.peekFirst();
        return (oldest != null ? oldest : now).plus(limits.getBurstWindow());
    }

    private Instant nextMidnight(Instant now) {
        return LocalDate.ofInstant(now, zone).plusDays(1).atStartOfDay(zone).toInstant();
    }

    /** 单个用户的计数；只在 compute 回调内被访问 */
    private static final class UserQuota {

        private final Deque<Instant> burst = new ArrayDeque<>();
        private final Map<String, Integer> perConversation = new HashMap<>();
        private LocalDate day;
        private int dailyCount;

        void roll(Instant now, Duration burstWindow, LocalDate today) {
            Instant cutoff = now.minus(burstWindow);
            while (!burst.isEmpty() && !burst.peekFirst().isAfter(cutoff)) {
                burst.pollFirst();
            }
            if (!today.equals(day)) {
                day = today;
                dailyCount = 0;
            }
        }

        void reserve(String conversationId, Instant now) {
            burst.addLast(now);
            dailyCount++;
            perConversation.merge(conversationId, 1, Integer::sum);
        }

        void release(String conversationId, Instant reservedAt, LocalDate reservedDay) {
            burst.removeLastOccurrence(reservedAt);
            if (reservedDay.equals(day) && dailyCount > 0) {
                dailyCount--;
            }
            perConversation.computeIfPresent(conversationId, (k, count) -> count > 1 ? count - 1 : null);
        }

        int conversationCount(String conversationId) {
            return perConversation.getOrDefault(conversationId, 0);
        }
    }
}
