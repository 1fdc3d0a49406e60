package com.imperium.unbuilt.guard;

import java.util.List;

public record ModerationResult(boolean approved, Severity severity, List<String> categories, boolean requiresReview) {
}
