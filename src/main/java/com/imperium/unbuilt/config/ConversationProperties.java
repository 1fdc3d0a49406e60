package com.imperium.unbuilt.config;

import com.imperium.unbuilt.policy.SubscriptionTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 对话流水线配置，前缀 app.conversation。
 * 字段默认值与 application.yaml 保持一致，便于在单元测试中直接 new 出来使用。
 */
@Data
@ConfigurationProperties(prefix = "app.conversation")
public class ConversationProperties {

    /** 各档位限额；-1 表示不限 */
    private Map<SubscriptionTier, TierLimits> limits = defaultLimits();

    private Context context = new Context();

    private Generation generation = new Generation();

    private Dedup dedup = new Dedup();

    /** 等待会话锁的上限 */
    private Duration lockWait = Duration.ofSeconds(90);

    /** 日限额按该时区的自然日重置 */
    private String dailyResetZone = "UTC";

    public TierLimits limitsFor(SubscriptionTier tier) {
        TierLimits configured = limits.get(tier != null ? tier : SubscriptionTier.FREE);
        return configured != null ? configured : TierLimits.unlimited(2000);
    }

    @Data
    public static class TierLimits {

        /** 突发窗口内最大条数 */
        private int burstLimit = -1;

        private Duration burstWindow = Duration.ofMinutes(1);

        /** 每日最大条数 */
        private int dailyLimit = -1;

        /** 单个分析会话最大问题数 */
        private int perConversationLimit = -1;

        /** 单条消息最大字符数 */
        private int maxMessageLength = 2000;

        public static TierLimits of(int burstLimit, int dailyLimit, int perConversationLimit, int maxMessageLength) {
            TierLimits limits = new TierLimits();
            limits.setBurstLimit(burstLimit);
            limits.setDailyLimit(dailyLimit);
            limits.setPerConversationLimit(perConversationLimit);
            limits.setMaxMessageLength(maxMessageLength);
            return limits;
        }

        public static TierLimits unlimited(int maxMessageLength) {
            return of(-1, -1, -1, maxMessageLength);
        }

        public boolean isUnlimited() {
            return burstLimit < 0 && dailyLimit < 0 && perConversationLimit < 0;
        }
    }

    @Data
    public static class Context {

        /** 上下文窗口 token 预算（摘要 + 历史 + 当前问题） */
        private int maxTokens = 8000;

        /** 每次加载的最近消息条数 */
        private int historyLimit = 20;

        /** 摘要中保留的缺口条数 */
        private int summaryGapLimit = 5;
    }

    @Data
    public static class Generation {

        /** 单次生成总时限 */
        private Duration timeout = Duration.ofSeconds(30);

        /** 流式：两个分片之间的最长间隔 */
        private Duration idleChunkTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Dedup {

        private boolean enabled = true;

        private double threshold = 0.9;

        /** 每个会话缓存的问答对数 */
        private int windowSize = 20;

        private long maxConversations = 10_000;

        private Duration expireAfterAccess = Duration.ofHours(2);
    }

    private static Map<SubscriptionTier, TierLimits> defaultLimits() {
        Map<SubscriptionTier, TierLimits> defaults = new EnumMap<>(SubscriptionTier.class);
        defaults.put(SubscriptionTier.FREE, TierLimits.of(10, 20, 5, 500));
        defaults.put(SubscriptionTier.PRO, TierLimits.unlimited(1000));
        defaults.put(SubscriptionTier.ENTERPRISE, TierLimits.unlimited(2000));
        return defaults;
    }
}
