package com.imperium.unbuilt.exception;

import java.util.Map;

/**
 * 举报过于频繁。
 */
public class ReportThrottledException extends ConversationPipelineException {

    private final long reportCount;

    public ReportThrottledException(long reportCount) {
        super(ErrorCode.QUOTA_EXCEEDED, "Too many reports submitted. Please try again later.");
        this.reportCount = reportCount;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("reportCount", reportCount);
    }
}
