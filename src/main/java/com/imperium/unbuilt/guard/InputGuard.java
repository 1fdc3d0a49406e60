package com.imperium.unbuilt.guard;

import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.policy.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * 第一道输入防线：长度、结构性恶意载荷与清洗。
 * <p>
 * 只处理“形状”问题（脚本、事件处理器、路径穿越、控制字符等）；
 * 语义层面的注入由 {@link InjectionDetector} 负责，这里不拦截“ignore previous instructions”之类的措辞。
 * 校验失败即整体拒绝，不会清洗一半继续往下走。
 */
@Component
public class InputGuard {

    private static final Logger securityLog = LoggerFactory.getLogger("security");

    /** 任何档位都不能超过的硬上限 */
    public static final int ABSOLUTE_MAX_LENGTH = 2000;

    /** 去掉脚本后至少要剩下的正常字符数 */
    private static final int MIN_LEGITIMATE_CHARS = 10;

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[^>]*>.*?(</script\\s*>|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern EVENT_HANDLER = Pattern.compile("<[^>]*\\bon\\w+\\s*=",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern JAVASCRIPT_URL = Pattern.compile("javascript\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern PATH_TRAVERSAL = Pattern.compile("\\.\\.[/\\\\]");
    private static final Pattern EXOTIC_RUN = Pattern.compile(
            "[^\\w\\s.,!?'\"@#$%^&*()+\\-=\\[\\]{};:<>/\\\\|`~]{10,}", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private final ConversationProperties properties;

    public InputGuard(ConversationProperties properties) {
        this.properties = properties;
    }

    public InputValidationResult validate(String rawText, SubscriptionTier tier, GuardContext ctx) {
        if (rawText == null || rawText.isBlank()) {
            return InputValidationResult.reject("Message cannot be empty", Severity.LOW);
        }

        int maxLength = maxLengthFor(tier);
        if (rawText.length() > maxLength) {
            return tooLong(maxLength);
        }

        String text = Normalizer.normalize(rawText, Normalizer.Form.NFKC).replace("\r\n", "\n").replace('\r', '\n');
        // 兼容字符可能展开成多个字符（如 U+FDFA 展开为 18 个），归一化后再量一次
        if (text.length() > maxLength) {
            securityLog.info("Message expanded past length limit by normalization: userId={}, conversationId={}, rawLength={}, normalizedLength={}",
                    ctx.userId(), ctx.conversationId(), rawText.length(), text.length());
            return tooLong(maxLength);
        }

        if (containsControlCharacters(text)) {
            return violation("Message contains invalid characters", Severity.HIGH, "control_characters", text, ctx);
        }
        if (EVENT_HANDLER.matcher(text).find()) {
            return violation("Message contains potentially malicious content", Severity.HIGH, "event_handler", text, ctx);
        }
        if (SCRIPT_BLOCK.matcher(text).find()) {
            String withoutScripts = SCRIPT_BLOCK.matcher(text).replaceAll("");
            String legitimate = HTML_TAG.matcher(withoutScripts).replaceAll("").trim();
            if (legitimate.length() < MIN_LEGITIMATE_CHARS) {
                return violation("Message contains potentially malicious content", Severity.HIGH, "script", text, ctx);
            }
            securityLog.info("Script block stripped from message: userId={}, conversationId={}",
                    ctx.userId(), ctx.conversationId());
            text = withoutScripts;
        }
        if (JAVASCRIPT_URL.matcher(text).find()) {
            return violation("Message contains potentially malicious content", Severity.HIGH, "javascript_url", text, ctx);
        }
        if (PATH_TRAVERSAL.matcher(text).find()) {
            return violation("Message contains potentially malicious content", Severity.MEDIUM, "path_traversal", text, ctx);
        }
        if (EXOTIC_RUN.matcher(text).find()) {
            return violation("Message contains unusual character sequences", Severity.MEDIUM, "exotic_characters", text, ctx);
        }

        String sanitized = normalizeWhitespace(HTML_TAG.matcher(text).replaceAll(""));
        if (sanitized.isEmpty()) {
            return InputValidationResult.reject("Message cannot be empty after removing markup", Severity.LOW);
        }
        return InputValidationResult.ok(sanitized);
    }

    public int maxLengthFor(SubscriptionTier tier) {
        return Math.min(ABSOLUTE_MAX_LENGTH, properties.limitsFor(tier).getMaxMessageLength());
    }

    // ==================== 私有 ====================

    private static InputValidationResult tooLong(int maxLength) {
        return InputValidationResult.reject(
                "Message is too long. Maximum length is " + maxLength + " characters", Severity.LOW);
    }

    private static boolean containsControlCharacters(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\t') {
                return true;
            }
        }
        return false;
    }

    private static String normalizeWhitespace(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(INLINE_WHITESPACE.matcher(lines[i]).replaceAll(" ").trim());
        }
        return EXCESS_NEWLINES.matcher(sb.toString()).replaceAll("\n\n").trim();
    }

    private static InputValidationResult violation(String reason, Severity severity, String type,
                                                   String text, GuardContext ctx) {
        securityLog.warn("Input rejected: type={}, severity={}, userId={}, conversationId={}, preview=\"{}\"",
                type, severity.code(), ctx.userId(), ctx.conversationId(), preview(text));
        return InputValidationResult.reject(reason, severity);
    }

    static String preview(String text) {
        if (text == null) {
            return "";
        }
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() > 100 ? oneLine.substring(0, 100) : oneLine;
    }
}
