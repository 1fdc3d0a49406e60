package com.imperium.unbuilt.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 第二道防线：提示注入检测。判定逻辑交给可替换的 {@link TextClassifier}。
 * 置信度超过 0.5 或命中任意规则即视为注入。
 */
@Component
public class InjectionDetector {

    private static final Logger securityLog = LoggerFactory.getLogger("security");

    public static final double CONFIDENCE_THRESHOLD = 0.5;

    /** 对用户展示的统一文案，不透露命中的规则 */
    public static final String USER_MESSAGE =
            "Your message contains content that violates our usage policy. Please rephrase your question.";

    private final TextClassifier classifier;

    public InjectionDetector(@Qualifier("injectionClassifier") TextClassifier injectionClassifier) {
        this.classifier = injectionClassifier;
    }

    public InjectionDetectionResult detect(String sanitizedText, GuardContext ctx) {
        ClassifierVerdict verdict = classifier.classify(sanitizedText);
        boolean injection = verdict.score() > CONFIDENCE_THRESHOLD || !verdict.categories().isEmpty();
        InjectionDetectionResult result = new InjectionDetectionResult(
                injection, verdict.score(), verdict.categories(), verdict.severity());
        if (injection) {
            securityLog.warn("Prompt injection detected: userId={}, conversationId={}, confidence={}, severity={}, patterns={}, preview=\"{}\"",
                    ctx.userId(), ctx.conversationId(), String.format("%.2f", verdict.score()),
                    verdict.severity().code(), verdict.categories(), InputGuard.preview(sanitizedText));
        }
        return result;
    }
}
