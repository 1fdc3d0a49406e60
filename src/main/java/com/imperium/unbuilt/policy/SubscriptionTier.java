package com.imperium.unbuilt.policy;

import java.util.Locale;

/**
 * 订阅档位。外部传入的档位字符串经 {@link #from(String)} 归一化。
 */
public enum SubscriptionTier {

    FREE,
    PRO,
    ENTERPRISE;

    /**
     * business / enterprise → ENTERPRISE；pro / premium → PRO；其它（含空）→ FREE。
     */
    public static SubscriptionTier from(String raw) {
        if (raw == null || raw.isBlank()) {
            return FREE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "business", "enterprise" -> ENTERPRISE;
            case "pro", "premium" -> PRO;
            default -> FREE;
        };
    }

    /** 流式回复只对付费档位开放 */
    public boolean supportsStreaming() {
        return this != FREE;
    }
}
