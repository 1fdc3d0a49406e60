package com.imperium.unbuilt.guard;

/**
 * 文本分类器接缝。默认实现基于正则规则，可替换为外部模型或审核接口。
 */
public interface TextClassifier {

    ClassifierVerdict classify(String text);
}
