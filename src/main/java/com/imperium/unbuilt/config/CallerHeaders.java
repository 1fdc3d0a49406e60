package com.imperium.unbuilt.config;

/**
 * 网关注入的调用方身份头。本服务不做鉴权，直接信任这些头。
 */
public final class CallerHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String SUBSCRIPTION_TIER = "X-Subscription-Tier";

    private CallerHeaders() {
    }

    /** 缺少 X-User-Id 时抛 IllegalArgumentException，由全局异常处理渲染为 invalid_argument */
    public static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException(USER_ID + " is required");
        }
        return userId.trim();
    }
}
