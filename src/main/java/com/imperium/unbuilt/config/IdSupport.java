package com.imperium.unbuilt.config;

import java.util.UUID;

/**
 * 业务 ID 生成：前缀 + 16 位十六进制。
 */
public final class IdSupport {

    private IdSupport() {
    }

    public static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
