package com.imperium.unbuilt.exception;

import com.imperium.unbuilt.policy.RateLimitDecision;

import java.util.Map;

public class QuotaExceededException extends ConversationPipelineException {

    private final RateLimitDecision decision;

    public QuotaExceededException(RateLimitDecision decision) {
        super(ErrorCode.QUOTA_EXCEEDED, messageFor(decision));
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("rateLimit", decision);
    }

    private static String messageFor(RateLimitDecision decision) {
        if (decision.getExceeded() == null) {
            return "Rate limit exceeded";
        }
        return switch (decision.getExceeded()) {
            case BURST -> "Too many messages in a short time. Please wait a moment and try again.";
            case DAILY -> "Daily message limit reached. Your quota resets at midnight.";
            case CONVERSATION -> "You have reached the question limit for this analysis. Upgrade to Pro for unlimited questions.";
        };
    }
}
