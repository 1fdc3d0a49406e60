package com.imperium.unbuilt.ai.generation;

public record GenerationResult(String content, GenerationMetadata metadata) {
}
