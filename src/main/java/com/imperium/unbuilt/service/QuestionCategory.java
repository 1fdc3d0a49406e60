package com.imperium.unbuilt.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 推荐问题类别。
 */
public enum QuestionCategory {

    MARKET_VALIDATION,
    COMPETITIVE_ANALYSIS,
    EXECUTION_STRATEGY,
    RISK_ASSESSMENT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 无法识别时返回 null */
    public static QuestionCategory fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (QuestionCategory c : values()) {
            if (c.code().equalsIgnoreCase(code.trim())) {
                return c;
            }
        }
        return null;
    }
}
