package com.imperium.unbuilt.service;

/**
 * 生成阶段的候选问题，priority 为 0~100。
 */
public record GeneratedQuestion(String text, QuestionCategory category, int priority) {

    public GeneratedQuestion withPriority(int newPriority) {
        return new GeneratedQuestion(text, category, newPriority);
    }
}
