package com.imperium.unbuilt.guard;

import java.util.List;

/**
 * 分类结果。score 为 0~1 的置信度，categories 为命中的类别（去重，按规则顺序）。
 */
public record ClassifierVerdict(boolean flagged, double score, Severity severity,
                                List<String> categories, boolean requiresReview) {

    public static ClassifierVerdict clean() {
        return new ClassifierVerdict(false, 0.0, Severity.LOW, List.of(), false);
    }
}
