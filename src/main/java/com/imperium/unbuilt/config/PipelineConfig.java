package com.imperium.unbuilt.config;

import com.imperium.unbuilt.ai.context.CharacterTokenEstimator;
import com.imperium.unbuilt.ai.context.TokenEstimator;
import com.imperium.unbuilt.guard.PatternInjectionClassifier;
import com.imperium.unbuilt.guard.PatternModerationClassifier;
import com.imperium.unbuilt.guard.TextClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 流水线可替换组件的默认实现：分类器、token 估算与时钟。
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TextClassifier injectionClassifier() {
        return new PatternInjectionClassifier();
    }

    @Bean
    public TextClassifier moderationClassifier() {
        return new PatternModerationClassifier();
    }

    @Bean
    public TokenEstimator tokenEstimator() {
        return new CharacterTokenEstimator();
    }
}
