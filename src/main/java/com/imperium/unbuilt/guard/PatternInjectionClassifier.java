package com.imperium.unbuilt.guard;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于规则的提示注入分类器。
 * 每个命中的类别累加其分值，置信度封顶 1.0；严重度取命中类别中的最高值。
 */
public class PatternInjectionClassifier implements TextClassifier {

    private static final List<PatternGroup> GROUPS = List.of(
            PatternGroup.of("system_override", 0.9, Severity.CRITICAL, true,
                    "ignore\\s+(all\\s+)?(previous|prior|above|earlier)\\s+(instructions?|prompts?|commands?|directives?)",
                    "disregard\\s+(all\\s+)?(previous|prior|above|earlier)\\s+(instructions?|prompts?|commands?)",
                    "forget\\s+(all\\s+)?(previous|prior|above|earlier|everything)(\\s+(instructions?|prompts?|you\\s+were\\s+told))?",
                    "override\\s+(previous|system|all)\\s+(instructions?|prompts?|settings?)",
                    "new\\s+(instructions?|prompts?|system\\s+prompt)\\s*:",
                    "reset\\s+(your\\s+)?(instructions?|prompts?|context|memory)",
                    "clear\\s+(your\\s+)?(instructions?|prompts?|context|memory)"),
            PatternGroup.of("role_switching", 0.8, Severity.HIGH, true,
                    "you\\s+are\\s+now\\s+(a|an)\\s+\\w+",
                    "\\bact\\s+as\\s+(a|an)\\s+\\w+",
                    "pretend\\s+(to\\s+be|you\\s+are)\\s+",
                    "\\broleplay\\s+as\\b",
                    "\\bsimulate\\s+(a|an|being)\\s+\\w+",
                    "behave\\s+(like|as)\\s+(a|an)\\s+\\w+",
                    "from\\s+now\\s+on,?\\s+you\\s+(are|will)"),
            PatternGroup.of("jailbreak", 1.0, Severity.CRITICAL, true,
                    "\\bjailbreak",
                    "\\bDAN\\s+mode\\b",
                    "\\b(developer|god|admin|unrestricted|debug)\\s+mode\\b",
                    "(bypass|disable|remove|turn\\s+off)\\s+(your\\s+)?(safety|filters?|restrictions?|guidelines|guardrails)"),
            PatternGroup.of("instruction_injection", 0.85, Severity.HIGH, true,
                    "\\[\\s*(system|assistant|instruction|admin)\\s*\\]",
                    "<\\|\\s*(system|assistant|im_start|im_end)\\s*\\|>",
                    "#{2,}\\s*(system|instruction|assistant)\\b",
                    "^\\s*(system|assistant)\\s*:"),
            PatternGroup.of("delimiter_manipulation", 0.6, Severity.MEDIUM, false,
                    "```\\s*(system|instruction|prompt)",
                    "-{3,}\\s*(system|instruction|end\\s+of\\s+prompt)",
                    "={3,}\\s*(system|instruction)"),
            PatternGroup.of("context_manipulation", 0.7, Severity.HIGH, true,
                    "(end|close)\\s+of\\s+(the\\s+)?(context|conversation|system\\s+prompt)",
                    "(previous|above)\\s+(context|conversation)\\s+(is|was)\\s+(fake|false|a\\s+test)",
                    "the\\s+real\\s+instructions?\\s+(is|are)"),
            PatternGroup.of("obfuscation", 0.5, Severity.MEDIUM, false,
                    "\\\\x[0-9a-f]{2}",
                    "\\\\u[0-9a-f]{4}",
                    "&#\\d+;",
                    "\\bbase64\\b",
                    "\\brot13\\b",
                    "\\\\[nrt]"),
            PatternGroup.of("prompt_extraction", 0.7, Severity.HIGH, true,
                    "(reveal|show|print|repeat|display|output)\\s+(me\\s+)?(your|the)\\s+(initial\\s+|original\\s+|hidden\\s+)?(instructions?|prompts?|system\\s+prompt|rules)",
                    "what\\s+(are|were)\\s+your\\s+(initial\\s+|original\\s+)?(instructions?|system\\s+prompt|rules)",
                    "repeat\\s+(everything|the\\s+text)\\s+above")
    );

    @Override
    public ClassifierVerdict classify(String text) {
        if (text == null || text.isBlank()) {
            return ClassifierVerdict.clean();
        }
        double score = 0.0;
        Severity severity = Severity.LOW;
        boolean review = false;
        List<String> categories = new ArrayList<>();
        for (PatternGroup group : GROUPS) {
            if (group.matches(text)) {
                categories.add(group.category());
                score += group.score();
                severity = severity.max(group.severity());
                review |= group.requiresReview();
            }
        }
        if (categories.isEmpty()) {
            return ClassifierVerdict.clean();
        }
        return new ClassifierVerdict(true, Math.min(1.0, score), severity, List.copyOf(categories), review);
    }
}
