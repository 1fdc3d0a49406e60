package com.imperium.unbuilt.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 被触发的限额维度。
 */
public enum QuotaScope {

    /** 短时间窗口内的突发条数 */
    BURST,
    /** 自然日总条数 */
    DAILY,
    /** 单个分析会话内的问题数 */
    CONVERSATION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
