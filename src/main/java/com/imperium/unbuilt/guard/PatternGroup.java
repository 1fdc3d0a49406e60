package com.imperium.unbuilt.guard;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 一组同类别的正则规则。
 */
record PatternGroup(String category, double score, Severity severity, boolean requiresReview,
                    List<Pattern> patterns) {

    static PatternGroup of(String category, double score, Severity severity, boolean requiresReview,
                           String... regexes) {
        return new PatternGroup(category, score, severity, requiresReview,
                Arrays.stream(regexes)
                        .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                        .toList());
    }

    static PatternGroup caseSensitive(String category, double score, Severity severity, boolean requiresReview,
                                      String... regexes) {
        return new PatternGroup(category, score, severity, requiresReview,
                Arrays.stream(regexes).map(Pattern::compile).toList());
    }

    boolean matches(String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
