package com.imperium.unbuilt.guard;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于规则的内容审核分类器。
 * financial_advice 只做标记（LOW），不会导致拒绝。
 */
public class PatternModerationClassifier implements TextClassifier {

    private static final List<PatternGroup> GROUPS = List.of(
            PatternGroup.of("self_harm", 1.0, Severity.CRITICAL, true,
                    "\\b(kill|hurt|harm)\\s+(myself|yourself)\\b",
                    "\\bsuicid(e|al)\\b",
                    "\\bend\\s+(my|your)\\s+life\\b",
                    "\\bself[\\s-]?harm\\b"),
            PatternGroup.of("hate_speech", 1.0, Severity.CRITICAL, true,
                    "\\b(hate|kill|exterminate)\\s+(all\\s+)?(jews|muslims|christians|blacks|whites|gays|immigrants)\\b",
                    "\\bn[i1]gg(a|er|ah)s?\\b",
                    "\\bf[a@]gg?[o0]ts?\\b",
                    "\\bk[i1]kes?\\b"),
            PatternGroup.of("harassment", 0.8, Severity.HIGH, true,
                    "\\byou\\s+(are|'re)\\s+(an?\\s+)?(idiot|moron|stupid|worthless|pathetic)\\b",
                    "\\b(shut\\s+up|go\\s+to\\s+hell|screw\\s+you)\\b",
                    "\\bi\\s+will\\s+(find|hunt)\\s+you\\b"),
            PatternGroup.of("violence", 0.8, Severity.HIGH, true,
                    "\\b(kill|murder|shoot|stab|attack)\\s+(him|her|them|people|someone|everyone)\\b",
                    "\\b(make|build)\\s+(a\\s+)?(bomb|explosive|weapon)\\b",
                    "\\bmass\\s+(shooting|murder)\\b"),
            PatternGroup.of("sexual_content", 0.6, Severity.MEDIUM, true,
                    "\\b(porn|pornography|xxx|nsfw)\\b",
                    "\\bsexual(ly)?\\s+explicit\\b",
                    "\\bnude\\s+(photos?|pics?|images?)\\b"),
            PatternGroup.caseSensitive("spam", 0.5, Severity.MEDIUM, false,
                    "\\b[A-Z]{10,}\\b",
                    "(.)\\1{9,}",
                    "(?i)\\b(buy\\s+now|click\\s+here|limited\\s+time\\s+offer|act\\s+now)\\b",
                    "(https?://\\S+\\s*){3,}"),
            PatternGroup.of("scam", 0.8, Severity.HIGH, true,
                    "\\b(send|wire|transfer)\\s+(me\\s+)?(money|bitcoin|crypto|gift\\s+cards?)\\b",
                    "\\bguaranteed\\s+(returns?|profits?|income)\\b",
                    "\\b(get\\s+rich\\s+quick|double\\s+your\\s+money)\\b",
                    "\\b(social\\s+security|credit\\s+card|bank\\s+account)\\s+(number|details)\\b"),
            PatternGroup.of("financial_advice", 0.2, Severity.LOW, false,
                    "\\b(should\\s+i\\s+invest|investment\\s+advice|buy\\s+(stocks?|shares|crypto))\\b",
                    "\\b(stock\\s+tips?|price\\s+target)\\b")
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
                score = Math.max(score, group.score());
                severity = severity.max(group.severity());
                review |= group.requiresReview();
            }
        }
        if (categories.isEmpty()) {
            return ClassifierVerdict.clean();
        }
        return new ClassifierVerdict(true, score, severity, List.copyOf(categories), review);
    }
}
