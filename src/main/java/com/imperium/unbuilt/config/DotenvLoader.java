package com.imperium.unbuilt.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前加载项目根目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${KEY} 能解析到 .env 里的值。
 * 已存在的同名系统属性或环境变量优先，不会被覆盖。
 * <p>
 * 在 Spring 启动前运行，此时日志系统尚未初始化，因此直接输出到标准输出。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private static final String OPENAI_BASE_URL_KEY = "OPENAI_BASE_URL";

    private DotenvLoader() {
    }

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    static void load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env file not found at: " + envPath);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to load .env: " + e.getMessage());
            return;
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1);
            if (System.getProperty(key) != null || System.getenv(key) != null) {
                continue;
            }
            String value = unquote(matcher.group(2).trim());
            // Spring AI 的 OpenAI client 会自动拼接 /v1，base-url 以 /v1 结尾会变成 /v1/v1 而 404
            if (OPENAI_BASE_URL_KEY.equals(key)) {
                value = stripVersionSuffix(value);
            }
            System.setProperty(key, value);
            System.out.println("[DotenvLoader] Loaded: " + key + " = " + (key.contains("KEY") ? "***" : value));
        }
    }

    static String stripVersionSuffix(String value) {
        String v = value.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        if (v.endsWith("/v1")) {
            v = v.substring(0, v.length() - 3);
        }
        return v;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
