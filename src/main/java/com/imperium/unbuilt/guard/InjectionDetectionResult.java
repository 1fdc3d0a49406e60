package com.imperium.unbuilt.guard;

import java.util.List;

public record InjectionDetectionResult(boolean injection, double confidence,
                                       List<String> matchedPatterns, Severity severity) {
}
