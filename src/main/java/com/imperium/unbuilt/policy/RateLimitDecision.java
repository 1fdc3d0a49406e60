package com.imperium.unbuilt.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 限流判定结果，同时作为对外的 rateLimit 视图。
 * remaining / limit 取各维度中最紧的那个；unlimited 档位两者均为 -1。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitDecision {

    public static final int UNLIMITED = -1;

    private boolean allowed;

    private int remaining;

    private int limit;

    /** 最紧维度的重置时间；会话维度不会自动重置，为 null */
    private Instant resetAt;

    private boolean unlimited;

    private SubscriptionTier tier;

    /** 拒绝时被触发的维度 */
    private QuotaScope exceeded;

    /** 本次预占写入突发窗口的时间点，退还时按它精确撤销；未预占为 null */
    @JsonIgnore
    private Instant reservedAt;

    public static RateLimitDecision unlimited(SubscriptionTier tier) {
        return RateLimitDecision.builder()
                .allowed(true)
                .remaining(UNLIMITED)
                .limit(UNLIMITED)
                .unlimited(true)
                .tier(tier)
                .build();
    }
}
